package org.hypertrace.core.metrics.query.service.frame;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** start, start + step, start + 2 * step, ... up to the last point not after end. */
@EqualsAndHashCode
@ToString
class FixedStepTimeGrid implements TimeGrid {
  private final long startMillis;
  private final long stepMillis;
  private final int size;

  FixedStepTimeGrid(long startMillis, long endMillis, long stepMillis) {
    Preconditions.checkArgument(stepMillis > 0, "step has to be positive, got %s", stepMillis);
    Preconditions.checkArgument(
        startMillis <= endMillis, "start %s is after end %s", startMillis, endMillis);
    this.startMillis = startMillis;
    this.stepMillis = stepMillis;
    this.size = Math.toIntExact(Math.subtractExact(endMillis, startMillis) / stepMillis + 1);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public long timestampAt(int position) {
    Preconditions.checkElementIndex(position, size);
    return startMillis + position * stepMillis;
  }

  @Override
  public int indexOf(long timestampMillis) {
    long offset = timestampMillis - startMillis;
    if (offset < 0 || offset % stepMillis != 0) {
      return -1;
    }
    long position = offset / stepMillis;
    return position < size ? (int) position : -1;
  }

  @Override
  public List<Instant> toInstants() {
    List<Instant> instants = new ArrayList<>(size);
    for (int position = 0; position < size; position++) {
      instants.add(Instant.ofEpochMilli(timestampAt(position)));
    }
    return instants;
  }
}
