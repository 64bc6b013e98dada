package org.hypertrace.core.metrics.query.service;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.subjects.CompletableSubject;

/**
 * Handle the caller keeps for one batch execution. Cancelling it, e.g. when the client of the
 * caller disconnects, abandons all in-flight backend calls of the batch.
 */
public class BatchContext {
  private final CompletableSubject cancellation = CompletableSubject.create();

  public void cancel() {
    cancellation.onComplete();
  }

  public boolean isCancelled() {
    return cancellation.hasComplete();
  }

  Completable getCancellation() {
    return cancellation;
  }
}
