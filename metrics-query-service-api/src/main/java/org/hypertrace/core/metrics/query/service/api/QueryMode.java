package org.hypertrace.core.metrics.query.service.api;

public enum QueryMode {
  /** Evaluated over [start, end] at a fixed step, answered with a matrix. */
  RANGE,
  /** Evaluated at a single instant, answered with a vector. */
  INSTANT
}
