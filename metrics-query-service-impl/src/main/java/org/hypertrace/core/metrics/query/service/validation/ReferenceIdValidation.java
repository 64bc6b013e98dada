package org.hypertrace.core.metrics.query.service.validation;

import io.reactivex.rxjava3.core.Completable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.metrics.query.service.api.InvalidBatchException;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;

class ReferenceIdValidation implements BatchValidation {

  @Override
  public Completable validate(List<MetricQuery> queries) {
    Set<String> refIds = new HashSet<>();
    for (MetricQuery query : queries) {
      String refId = query.getRefId();
      if (refId == null || refId.isBlank()) {
        return Completable.error(
            new InvalidBatchException(
                "Reference id is missing on query: " + query.getExpression()));
      }
      if (!refIds.add(refId)) {
        return Completable.error(
            new InvalidBatchException("Duplicate reference id in batch: " + refId));
      }
    }
    return Completable.complete();
  }
}
