package org.hypertrace.core.metrics.query.service.prometheus;

import java.util.Arrays;
import java.util.Optional;

/** https://prometheus.io/docs/prometheus/latest/querying/api/#expression-query-result-formats */
enum PromQLResultType {
  MATRIX("matrix"),
  VECTOR("vector"),
  SCALAR("scalar"),
  STRING("string");

  private final String value;

  PromQLResultType(String value) {
    this.value = value;
  }

  static Optional<PromQLResultType> fromValue(String value) {
    return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
  }

  boolean isConvertibleToFrame() {
    return this == MATRIX || this == VECTOR;
  }
}
