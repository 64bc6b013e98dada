package org.hypertrace.core.metrics.query.service.validation;

import io.reactivex.rxjava3.core.Completable;
import java.util.List;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;

public interface BatchValidation {
  /** Completes if the batch passes, errors with an InvalidBatchException otherwise. */
  Completable validate(List<MetricQuery> queries);
}
