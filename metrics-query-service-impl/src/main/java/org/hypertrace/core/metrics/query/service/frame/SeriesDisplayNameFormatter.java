package org.hypertrace.core.metrics.query.service.frame;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Names the value column of a series.
 *
 * <p>With a legend format every {@code {{label}}} placeholder is replaced by the value of that
 * label, unknown labels resolve to an empty string. Without one the name follows the prometheus
 * notation {@code metric{a="1", b="2"}} with label names sorted; a series without any label is
 * named after the query expression.
 */
class SeriesDisplayNameFormatter {
  private static final String METRIC_NAME_LABEL = "__name__";
  private static final Pattern LEGEND_PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.+?)\\s*}}");

  String format(Map<String, String> labels, Optional<String> legendFormat, String expression) {
    if (legendFormat.isPresent()) {
      return formatLegend(labels, legendFormat.get());
    }
    if (labels.isEmpty()) {
      return expression;
    }

    String metricName = labels.getOrDefault(METRIC_NAME_LABEL, "");
    String labelString =
        new TreeMap<>(labels)
            .entrySet().stream()
                .filter(entry -> !METRIC_NAME_LABEL.equals(entry.getKey()))
                .map(entry -> entry.getKey() + "=\"" + entry.getValue() + "\"")
                .collect(Collectors.joining(", "));
    return labelString.isEmpty() ? metricName : metricName + "{" + labelString + "}";
  }

  private String formatLegend(Map<String, String> labels, String legendFormat) {
    Matcher matcher = LEGEND_PLACEHOLDER.matcher(legendFormat);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String value = labels.getOrDefault(matcher.group(1), "");
      matcher.appendReplacement(result, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
