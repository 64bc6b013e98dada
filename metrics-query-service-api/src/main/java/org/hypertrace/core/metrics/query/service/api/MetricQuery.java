package org.hypertrace.core.metrics.query.service.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single PromQL query of a batch. The reference id correlates the query with its entry in the
 * {@link BatchResponse}, so it has to be unique within one batch.
 *
 * <p>Range queries need {@code start}, {@code end} and {@code step}. Instant queries are evaluated
 * at {@code end}, falling back to the time of execution when it is not set.
 */
@Value
@Builder
public class MetricQuery {
  String refId;

  @NonNull String expression;

  @NonNull @Builder.Default QueryMode mode = QueryMode.RANGE;

  Instant start;

  /* inclusive */
  Instant end;

  /*
   * It refers to the step query param argument of PromQL range query Rest API.
   * https://prometheus.io/docs/prometheus/latest/querying/api/#range-queries
   * */
  Duration step;

  /*
   * Optional display name template for the value columns, e.g. "{{job}} - {{instance}}".
   * */
  String legendFormat;

  public boolean isRangeQuery() {
    return mode == QueryMode.RANGE;
  }

  public Optional<String> getLegendFormat() {
    return Optional.ofNullable(legendFormat).filter(format -> !format.isBlank());
  }
}
