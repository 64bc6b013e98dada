package org.hypertrace.core.metrics.query.service.prometheus;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Envelope of the Prometheus HTTP API.
 * https://prometheus.io/docs/prometheus/latest/querying/api/#format-overview
 *
 * <p>The {@code result} payload is kept as a tree since its shape depends on the result type; see
 * {@link PromQLResultParser}.
 */
@Value
@Jacksonized
@Builder
public class PromQLMetricResponse {
  private static final String STATUS_SUCCESS = "success";
  private static final String STATUS_ERROR = "error";

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

  @JsonProperty("status")
  String status;

  @JsonProperty("data")
  PromQLData data;

  @JsonProperty("errorType")
  String errorType;

  @JsonProperty("error")
  String error;

  @JsonProperty("warnings")
  @Singular
  List<String> warnings;

  boolean isSuccess() {
    return STATUS_SUCCESS.equals(status);
  }

  boolean isError() {
    return STATUS_ERROR.equals(status);
  }

  @Value
  @Jacksonized
  @Builder
  public static class PromQLData {
    @JsonProperty("resultType")
    String resultType;

    @JsonProperty("result")
    JsonNode result;
  }

  @Value
  @Builder
  @NoArgsConstructor(force = true)
  @AllArgsConstructor
  static class PromQLMetricResult {
    @JsonProperty("metric")
    @Singular
    Map<String, String> metricAttributes;

    @JsonAlias({"value", "values"})
    @JsonDeserialize(using = PromQLMetricValuesDeserializer.class)
    @Singular
    List<PromQLMetricValue> values;
  }

  /* timestamp in (fractional) seconds, value as the raw token sent by the backend */
  @Value
  static class PromQLMetricValue {
    BigDecimal timestamp;
    String value;
  }

  static class PromQLMetricValuesDeserializer extends JsonDeserializer<List<PromQLMetricValue>> {

    @Override
    public List<PromQLMetricValue> deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      List<PromQLMetricValue> metricValues = new ArrayList<>();
      JsonNode node = parser.getCodec().readTree(parser);
      if (!node.isArray()) {
        throw JsonMappingException.from(parser, "Expected an array of samples but got: " + node);
      }
      if (node.size() > 0 && node.get(0).isArray()) {
        // matrix: [[ts, "v"], [ts, "v"], ...]
        for (JsonNode element : node) {
          metricValues.add(parseValue(parser, element));
        }
      } else if (node.size() > 0) {
        // vector: [ts, "v"]
        metricValues.add(parseValue(parser, node));
      }
      return metricValues;
    }

    private PromQLMetricValue parseValue(JsonParser parser, JsonNode pair)
        throws JsonMappingException {
      if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isNumber()) {
        throw JsonMappingException.from(parser, "Malformed sample: " + pair);
      }
      return new PromQLMetricValue(pair.get(0).decimalValue(), pair.get(1).asText());
    }
  }

  static PromQLMetricResponse fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, PromQLMetricResponse.class);
  }

  static PromQLMetricResult toMetricResult(JsonNode node) throws IOException {
    return OBJECT_MAPPER.treeToValue(node, PromQLMetricResult.class);
  }
}
