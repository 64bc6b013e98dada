package org.hypertrace.core.metrics.query.service.api;

public enum ErrorType {
  /** The backend could not be reached or answered with an unexpected HTTP status. */
  TRANSPORT,
  /** The backend answered with status "error", e.g. a bad expression or a timeout. */
  BACKEND,
  /** Scalar and string results can't be turned into a frame. */
  UNSUPPORTED_RESULT_TYPE,
  /** A sample value is neither a number nor one of "NaN", "+Inf", "-Inf". */
  MALFORMED_VALUE,
  /** The body is not a Prometheus API response. */
  MALFORMED_RESPONSE
}
