package org.hypertrace.core.metrics.query.service.validation;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.exceptions.CompositeException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.metrics.query.service.api.InvalidBatchException;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;

/**
 * Batch validator invokes each registered validation, passing only if all complete successfully.
 * Validations may be performed in any order. When more than one fails, their messages are joined
 * into a single {@link InvalidBatchException}.
 */
public class BatchValidator {
  private final Set<BatchValidation> validations;

  @Inject
  public BatchValidator(Set<BatchValidation> validations) {
    this.validations = validations;
  }

  public Completable validate(List<MetricQuery> queries) {
    return Observable.fromIterable(validations)
        .flatMapCompletable(validation -> validation.validate(queries), true)
        .onErrorResumeNext(error -> Completable.error(unwrap(error)));
  }

  private Throwable unwrap(Throwable error) {
    if (!(error instanceof CompositeException)) {
      return error;
    }
    return new InvalidBatchException(
        ((CompositeException) error)
            .getExceptions().stream().map(Throwable::getMessage).collect(Collectors.joining("; ")));
  }
}
