package org.hypertrace.core.metrics.query.service.api;

import lombok.NonNull;
import lombok.Value;

@Value
public class QueryError {
  @NonNull ErrorType type;
  @NonNull String message;
}
