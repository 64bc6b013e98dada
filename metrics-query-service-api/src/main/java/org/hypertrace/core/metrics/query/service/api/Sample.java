package org.hypertrace.core.metrics.query.service.api;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One data point of a series. The value may be {@code NaN} or an infinity: those are results of
 * the evaluated expression, not errors.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Sample {
  private final long timestampMillis;
  private final double value;
}
