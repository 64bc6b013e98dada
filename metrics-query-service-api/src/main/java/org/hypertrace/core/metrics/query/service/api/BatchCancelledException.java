package org.hypertrace.core.metrics.query.service.api;

public class BatchCancelledException extends RuntimeException {

  public BatchCancelledException(String message) {
    super(message);
  }
}
