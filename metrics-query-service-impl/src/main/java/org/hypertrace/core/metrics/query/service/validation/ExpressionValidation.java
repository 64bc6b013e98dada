package org.hypertrace.core.metrics.query.service.validation;

import io.reactivex.rxjava3.core.Completable;
import java.util.List;
import org.hypertrace.core.metrics.query.service.api.InvalidBatchException;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;

/** The expression itself is left to prometheus, only blank ones are rejected up front. */
class ExpressionValidation implements BatchValidation {

  @Override
  public Completable validate(List<MetricQuery> queries) {
    return queries.stream()
        .filter(query -> query.getExpression().isBlank())
        .findFirst()
        .map(
            query ->
                Completable.error(
                    new InvalidBatchException(
                        "Expression is missing on query: " + query.getRefId())))
        .orElse(Completable.complete());
  }
}
