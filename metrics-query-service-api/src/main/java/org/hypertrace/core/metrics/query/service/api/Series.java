package org.hypertrace.core.metrics.query.service.api;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/** A label set with its samples, ordered by timestamp and free of duplicate timestamps. */
@Getter
@EqualsAndHashCode
@ToString
public class Series {
  private final Map<String, String> labels;
  private final List<Sample> samples;

  public Series(@NonNull Map<String, String> labels, @NonNull List<Sample> samples) {
    this.labels = ImmutableMap.copyOf(labels);
    this.samples = ImmutableList.copyOf(samples);
  }
}
