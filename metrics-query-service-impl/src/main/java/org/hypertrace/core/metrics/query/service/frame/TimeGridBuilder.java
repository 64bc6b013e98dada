package org.hypertrace.core.metrics.query.service.frame;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.hypertrace.core.metrics.query.service.api.Sample;
import org.hypertrace.core.metrics.query.service.api.Series;

/** Builds the grid a frame is aligned to. Both methods depend on their arguments only. */
public class TimeGridBuilder {

  /**
   * Grid of a range query. If {@code end - start} is not a multiple of {@code step} the grid stops
   * at the last point before {@code end}, it never overshoots it. Start and end are truncated to
   * milliseconds, the step has to be whole milliseconds.
   */
  public TimeGrid forRange(Instant start, Instant end, Duration step) {
    long startMillis = start.toEpochMilli();
    long endMillis = end.toEpochMilli();
    long stepMillis = step.toMillis();
    Preconditions.checkArgument(
        Duration.ofMillis(stepMillis).equals(step), "step %s is not whole milliseconds", step);
    Preconditions.checkArgument(stepMillis > 0, "step has to be positive, got %s", step);
    Preconditions.checkArgument(
        (endMillis - startMillis) / stepMillis < Integer.MAX_VALUE,
        "range from %s to %s with step %s has too many points for a frame",
        start,
        end,
        step);
    return new FixedStepTimeGrid(startMillis, endMillis, stepMillis);
  }

  /** Grid of an instant query: every distinct sample timestamp of the result, ascending. */
  public TimeGrid forObserved(List<Series> seriesList) {
    long[] timestamps =
        seriesList.stream()
            .flatMap(series -> series.getSamples().stream())
            .mapToLong(Sample::getTimestampMillis)
            .distinct()
            .sorted()
            .toArray();
    return new ObservedTimeGrid(timestamps);
  }
}
