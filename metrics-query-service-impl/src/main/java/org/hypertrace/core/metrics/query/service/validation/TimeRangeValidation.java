package org.hypertrace.core.metrics.query.service.validation;

import io.reactivex.rxjava3.core.Completable;
import java.util.List;
import java.util.Optional;
import org.hypertrace.core.metrics.query.service.api.InvalidBatchException;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;

/**
 * Range queries need a start not after their end and a step of whole milliseconds, at least one.
 * How many points a range may have is up to the backend.
 */
class TimeRangeValidation implements BatchValidation {
  private static final int NANOS_PER_MILLI = 1_000_000;

  @Override
  public Completable validate(List<MetricQuery> queries) {
    return queries.stream()
        .filter(MetricQuery::isRangeQuery)
        .map(this::findViolation)
        .flatMap(Optional::stream)
        .findFirst()
        .map(message -> Completable.error(new InvalidBatchException(message)))
        .orElse(Completable.complete());
  }

  private Optional<String> findViolation(MetricQuery query) {
    if (query.getStart() == null || query.getEnd() == null || query.getStep() == null) {
      return Optional.of(
          String.format(
              "Range query %s requires start, end and step, got start: %s, end: %s, step: %s",
              query.getRefId(), query.getStart(), query.getEnd(), query.getStep()));
    }

    long startMillis = query.getStart().toEpochMilli();
    long endMillis = query.getEnd().toEpochMilli();
    long stepMillis = query.getStep().toMillis();
    if (stepMillis <= 0) {
      return Optional.of(
          String.format(
              "Range query %s requires a positive step, got: %s",
              query.getRefId(), query.getStep()));
    }
    if (query.getStep().getNano() % NANOS_PER_MILLI != 0) {
      return Optional.of(
          String.format(
              "Range query %s requires a step of whole milliseconds, got: %s",
              query.getRefId(), query.getStep()));
    }
    if (startMillis > endMillis) {
      return Optional.of(
          String.format(
              "Range query %s has start %s after end %s",
              query.getRefId(), query.getStart(), query.getEnd()));
    }
    return Optional.empty();
  }
}
