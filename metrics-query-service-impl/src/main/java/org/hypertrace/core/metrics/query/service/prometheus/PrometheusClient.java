package org.hypertrace.core.metrics.query.service.prometheus;

import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.time.Instant;

/**
 * Read access to a Prometheus compatible query API. Both calls fail with a {@link
 * org.hypertrace.core.metrics.query.service.QueryExecutionException} describing what went wrong,
 * and disposing the returned {@link Single} abandons the request.
 */
public interface PrometheusClient {

  Single<PromQLMetricResponse> queryRange(
      String expression, Instant start, Instant end, Duration step);

  Single<PromQLMetricResponse> query(String expression, Instant evalTime);
}
