package org.hypertrace.core.metrics.query.service.prometheus;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.service.QueryExecutionException;
import org.hypertrace.core.metrics.query.service.api.Sample;
import org.hypertrace.core.metrics.query.service.api.Series;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse.PromQLData;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse.PromQLMetricResult;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse.PromQLMetricValue;

/**
 * Converts the result of a successful query into a list of {@link Series}. Only matrix and vector
 * results are accepted, anything else is rejected before its payload is looked at.
 *
 * <p>Stateless, a single instance can be used by concurrent queries.
 */
@Slf4j
public class PromQLResultParser {

  public List<Series> parse(PromQLMetricResponse response) {
    PromQLData data = response.getData();
    if (data == null) {
      throw QueryExecutionException.malformedResponse("Response has no data block", null);
    }

    PromQLResultType resultType =
        PromQLResultType.fromValue(data.getResultType())
            .filter(PromQLResultType::isConvertibleToFrame)
            .orElseThrow(() -> QueryExecutionException.unsupportedResultType(data.getResultType()));

    JsonNode result = data.getResult();
    if (result == null || result.isNull()) {
      return List.of();
    }
    if (!result.isArray()) {
      throw QueryExecutionException.malformedResponse(
          String.format("Expected an array as %s result", data.getResultType()), null);
    }

    List<Series> seriesList = new ArrayList<>(result.size());
    for (JsonNode element : result) {
      seriesList.add(toSeries(readMetricResult(element), resultType));
    }
    log.debug("Parsed {} series from {} result", seriesList.size(), data.getResultType());
    return seriesList;
  }

  private PromQLMetricResult readMetricResult(JsonNode element) {
    try {
      return PromQLMetricResponse.toMetricResult(element);
    } catch (IOException e) {
      throw QueryExecutionException.malformedResponse("Malformed series: " + e.getMessage(), e);
    }
  }

  private Series toSeries(PromQLMetricResult metricResult, PromQLResultType resultType) {
    Map<String, String> labels =
        metricResult.getMetricAttributes() == null ? Map.of() : metricResult.getMetricAttributes();
    List<PromQLMetricValue> values =
        metricResult.getValues() == null ? List.of() : metricResult.getValues();

    if (resultType == PromQLResultType.VECTOR && values.size() != 1) {
      throw QueryExecutionException.malformedResponse(
          String.format("Vector series %s has %d samples, expected 1", labels, values.size()),
          null);
    }

    // ordered by timestamp, the first sample of a timestamp wins
    TreeMap<Long, Sample> samples = new TreeMap<>();
    for (PromQLMetricValue value : values) {
      long timestamp = SampleValueParser.toEpochMillis(value.getTimestamp());
      Sample sample = new Sample(timestamp, SampleValueParser.parseValue(value.getValue()));
      if (samples.putIfAbsent(timestamp, sample) != null) {
        log.debug("Dropping duplicate sample at {} of series {}", timestamp, labels);
      }
    }
    return new Series(labels, new ArrayList<>(samples.values()));
  }
}
