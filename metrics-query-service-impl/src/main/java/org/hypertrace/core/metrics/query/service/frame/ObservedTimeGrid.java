package org.hypertrace.core.metrics.query.service.frame;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Grid made of the distinct timestamps found in a result, used for instant queries. */
@EqualsAndHashCode
@ToString
class ObservedTimeGrid implements TimeGrid {
  private final long[] timestamps;

  /* timestamps have to be sorted and distinct */
  ObservedTimeGrid(long[] timestamps) {
    for (int i = 1; i < timestamps.length; i++) {
      Preconditions.checkArgument(
          timestamps[i - 1] < timestamps[i], "timestamps are not strictly increasing");
    }
    this.timestamps = timestamps.clone();
  }

  @Override
  public int size() {
    return timestamps.length;
  }

  @Override
  public long timestampAt(int position) {
    Preconditions.checkElementIndex(position, timestamps.length);
    return timestamps[position];
  }

  @Override
  public int indexOf(long timestampMillis) {
    int position = Arrays.binarySearch(timestamps, timestampMillis);
    return position >= 0 ? position : -1;
  }

  @Override
  public List<Instant> toInstants() {
    return Arrays.stream(timestamps).mapToObj(Instant::ofEpochMilli).collect(Collectors.toList());
  }
}
