package org.hypertrace.core.metrics.query.service.api;

/** The batch was rejected before any query was sent, e.g. because of a duplicate reference id. */
public class InvalidBatchException extends RuntimeException {

  public InvalidBatchException(String message) {
    super(message);
  }
}
