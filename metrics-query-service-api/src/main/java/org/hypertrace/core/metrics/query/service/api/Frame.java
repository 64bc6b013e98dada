package org.hypertrace.core.metrics.query.service.api;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Tabular result of one query: a timestamp column shared by one value column per returned series.
 * Every value column has exactly as many entries as there are timestamps.
 */
@Value
@Builder
public class Frame {
  @NonNull String refId;

  @NonNull @Singular List<Instant> timestamps;

  @NonNull @Singular List<ValueColumn> columns;

  /* e.g. "Expr: rate(http_requests_total[1m])\nStep: 15s" */
  String executedQueryString;

  @NonNull @Singular List<String> warnings;

  public int getRowCount() {
    return timestamps.size();
  }
}
