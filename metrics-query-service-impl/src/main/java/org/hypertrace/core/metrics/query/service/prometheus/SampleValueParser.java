package org.hypertrace.core.metrics.query.service.prometheus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;
import org.hypertrace.core.metrics.query.service.QueryExecutionException;

/**
 * Converts the raw sample tokens of the Prometheus API. Values are strings holding either a
 * decimal number or one of the sentinels "NaN", "+Inf" and "-Inf"; timestamps are (fractional)
 * unix seconds.
 */
class SampleValueParser {
  static final String NAN = "NaN";
  static final String POSITIVE_INFINITY = "+Inf";
  static final String NEGATIVE_INFINITY = "-Inf";

  private static final Pattern DECIMAL_NUMBER =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private SampleValueParser() {}

  static double parseValue(String token) {
    if (token == null) {
      throw QueryExecutionException.malformedValue("null");
    }
    switch (token) {
      case NAN:
        return Double.NaN;
      case POSITIVE_INFINITY:
        return Double.POSITIVE_INFINITY;
      case NEGATIVE_INFINITY:
        return Double.NEGATIVE_INFINITY;
      default:
        if (!DECIMAL_NUMBER.matcher(token).matches()) {
          throw QueryExecutionException.malformedValue(token);
        }
        return Double.parseDouble(token);
    }
  }

  /* exact conversion, sub-millisecond fractions are rounded half up */
  static long toEpochMillis(BigDecimal epochSeconds) {
    return epochSeconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }
}
