package org.hypertrace.core.metrics.query.service;

import lombok.Getter;
import org.hypertrace.core.metrics.query.service.api.ErrorType;
import org.hypertrace.core.metrics.query.service.api.QueryError;

/**
 * Failure of a single query. It never leaves the pipeline of its query: the dispatcher turns it
 * into a {@link QueryError} stored under the query's reference id.
 */
@Getter
public class QueryExecutionException extends RuntimeException {
  private final ErrorType errorType;

  public QueryExecutionException(ErrorType errorType, String message) {
    super(message);
    this.errorType = errorType;
  }

  public QueryExecutionException(ErrorType errorType, String message, Throwable cause) {
    super(message, cause);
    this.errorType = errorType;
  }

  public static QueryExecutionException transport(String message, Throwable cause) {
    return new QueryExecutionException(ErrorType.TRANSPORT, message, cause);
  }

  public static QueryExecutionException backend(String message) {
    return new QueryExecutionException(ErrorType.BACKEND, message);
  }

  public static QueryExecutionException unsupportedResultType(String resultType) {
    return new QueryExecutionException(
        ErrorType.UNSUPPORTED_RESULT_TYPE,
        String.format("Unsupported result type: %s, expected vector or matrix", resultType));
  }

  public static QueryExecutionException malformedValue(String token) {
    return new QueryExecutionException(
        ErrorType.MALFORMED_VALUE, String.format("Malformed sample value: \"%s\"", token));
  }

  public static QueryExecutionException malformedResponse(String message, Throwable cause) {
    return new QueryExecutionException(ErrorType.MALFORMED_RESPONSE, message, cause);
  }

  public QueryError toQueryError() {
    return new QueryError(errorType, getMessage());
  }
}
