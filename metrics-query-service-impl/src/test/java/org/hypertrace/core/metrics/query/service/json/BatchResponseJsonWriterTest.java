package org.hypertrace.core.metrics.query.service.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.metrics.query.service.api.BatchResponse;
import org.hypertrace.core.metrics.query.service.api.ErrorType;
import org.hypertrace.core.metrics.query.service.api.Frame;
import org.hypertrace.core.metrics.query.service.api.QueryError;
import org.hypertrace.core.metrics.query.service.api.QueryOutcome;
import org.hypertrace.core.metrics.query.service.api.ValueColumn;
import org.junit.jupiter.api.Test;

class BatchResponseJsonWriterTest {
  private static final Instant T0 = Instant.ofEpochSecond(1641889530L);

  private final BatchResponseJsonWriter jsonWriter = new BatchResponseJsonWriter();

  @Test
  void writesValuesAndSentinels() {
    ObjectNode json = jsonWriter.toJson(response());

    JsonNode fields = json.get("A").get("frame").get("fields");
    assertEquals(BatchResponseJsonWriter.TIME_FIELD_NAME, fields.get(0).get("name").asText());
    assertEquals(1641889530000L, fields.get(0).get("values").get(0).asLong());
    assertEquals(1641889531000L, fields.get(0).get("values").get(1).asLong());

    JsonNode values = fields.get(1).get("values");
    assertEquals(21.5, values.get(0).asDouble());
    assertTrue(values.get(1).isNull());
    assertEquals("NaN", values.get(2).asText());
    assertEquals("+Inf", values.get(3).asText());
    assertEquals("-Inf", values.get(4).asText());
    assertEquals("node", fields.get(1).get("labels").get("job").asText());
  }

  @Test
  void writesErrorEntries() {
    JsonNode error = jsonWriter.toJson(response()).get("B");

    assertTrue(error.has("error"));
    assertFalse(error.has("frame"));
    assertEquals("TRANSPORT", error.get("error").get("type").asText());
    assertEquals("connection refused", error.get("error").get("message").asText());
  }

  @Test
  void keepsSubmissionOrder() {
    List<String> refIds = new ArrayList<>();
    jsonWriter.toJson(response()).fieldNames().forEachRemaining(refIds::add);

    assertEquals(List.of("A", "B"), refIds);
  }

  @Test
  void writesSameTextForEqualResponses() throws Exception {
    String first = jsonWriter.write(response());
    String second = jsonWriter.write(response());

    assertEquals(first, second);
    assertEquals(jsonWriter.toJson(response()), new ObjectMapper().readTree(first));
  }

  private static BatchResponse response() {
    Frame frame =
        Frame.builder()
            .refId("A")
            .timestamp(T0)
            .timestamp(T0.plusSeconds(1))
            .timestamp(T0.plusSeconds(2))
            .timestamp(T0.plusSeconds(3))
            .timestamp(T0.plusSeconds(4))
            .column(
                new ValueColumn(
                    "up{job=\"node\"}",
                    Map.of("__name__", "up", "job", "node"),
                    Arrays.asList(
                        21.5,
                        null,
                        Double.NaN,
                        Double.POSITIVE_INFINITY,
                        Double.NEGATIVE_INFINITY)))
            .executedQueryString("Expr: up\nStep: 1s")
            .build();

    Map<String, QueryOutcome> outcomes = new LinkedHashMap<>();
    outcomes.put("A", QueryOutcome.success(frame));
    outcomes.put(
        "B", QueryOutcome.failure(new QueryError(ErrorType.TRANSPORT, "connection refused")));
    return new BatchResponse(outcomes);
  }
}
