package org.hypertrace.core.metrics.query.service.frame;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.service.api.Frame;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;
import org.hypertrace.core.metrics.query.service.api.Sample;
import org.hypertrace.core.metrics.query.service.api.Series;
import org.hypertrace.core.metrics.query.service.api.ValueColumn;

/**
 * Aligns series to a {@link TimeGrid}. The grid is authoritative: a position without a sample of
 * exactly that timestamp stays missing ({@code null}), nothing is interpolated or rounded to a
 * neighbouring sample, and samples off the grid are dropped.
 */
@Slf4j
public class FrameAssembler {
  private final SeriesDisplayNameFormatter displayNameFormatter = new SeriesDisplayNameFormatter();

  public Frame assemble(
      MetricQuery query, TimeGrid grid, List<Series> seriesList, List<String> warnings) {
    Frame.FrameBuilder frameBuilder =
        Frame.builder()
            .refId(query.getRefId())
            .timestamps(grid.toInstants())
            .executedQueryString(buildExecutedQueryString(query))
            .warnings(warnings);

    for (Series series : seriesList) {
      frameBuilder.column(buildColumn(query, grid, series));
    }
    return frameBuilder.build();
  }

  private ValueColumn buildColumn(MetricQuery query, TimeGrid grid, Series series) {
    Double[] values = new Double[grid.size()];
    int droppedSamples = 0;
    for (Sample sample : series.getSamples()) {
      int position = grid.indexOf(sample.getTimestampMillis());
      if (position < 0) {
        droppedSamples++;
        continue;
      }
      values[position] = sample.getValue();
    }
    if (droppedSamples > 0) {
      log.debug(
          "Dropped {} samples off the time grid of query {} for series {}",
          droppedSamples,
          query.getRefId(),
          series.getLabels());
    }

    String name =
        displayNameFormatter.format(
            series.getLabels(), query.getLegendFormat(), query.getExpression());
    return new ValueColumn(name, series.getLabels(), Arrays.asList(values));
  }

  static String buildExecutedQueryString(MetricQuery query) {
    String executedQuery = "Expr: " + query.getExpression();
    if (query.isRangeQuery() && query.getStep() != null) {
      executedQuery += "\nStep: " + formatStep(query.getStep());
    }
    return executedQuery;
  }

  private static String formatStep(Duration step) {
    long millis = step.toMillis();
    return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
  }
}
