package org.hypertrace.core.metrics.query.service.api;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Values of one series aligned to the timestamp column of its {@link Frame}. A {@code null} entry
 * marks a grid position the series had no sample for.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ValueColumn {
  private final String name;
  private final Map<String, String> labels;
  private final List<Double> values;

  public ValueColumn(
      @NonNull String name, @NonNull Map<String, String> labels, @NonNull List<Double> values) {
    this.name = name;
    this.labels = ImmutableMap.copyOf(labels);
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }
}
