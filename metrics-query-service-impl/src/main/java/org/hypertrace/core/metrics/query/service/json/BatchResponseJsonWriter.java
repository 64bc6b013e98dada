package org.hypertrace.core.metrics.query.service.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import org.hypertrace.core.metrics.query.service.api.BatchResponse;
import org.hypertrace.core.metrics.query.service.api.Frame;
import org.hypertrace.core.metrics.query.service.api.QueryError;
import org.hypertrace.core.metrics.query.service.api.QueryOutcome;
import org.hypertrace.core.metrics.query.service.api.ValueColumn;

/**
 * Writes a {@link BatchResponse} as JSON, the form frames are handed to rendering layers in.
 *
 * <pre>
 * {
 *   "A": {
 *     "frame": {
 *       "refId": "A",
 *       "meta": {"executedQueryString": "...", "warnings": []},
 *       "fields": [
 *         {"name": "Time", "type": "time", "values": [1641889530000, ...]},
 *         {"name": "up{job=\"node\"}", "type": "number", "labels": {...}, "values": [1.0, null, "NaN"]}
 *       ]
 *     }
 *   },
 *   "B": {"error": {"type": "TRANSPORT", "message": "..."}}
 * }
 * </pre>
 *
 * Timestamps are epoch millis and missing values are {@code null}. JSON has no literal for the
 * sentinels, so they are written as the strings prometheus uses: "NaN", "+Inf" and "-Inf". The
 * output only depends on the response, entries keep the submission order.
 */
public class BatchResponseJsonWriter {
  static final String TIME_FIELD_NAME = "Time";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;

  public String write(BatchResponse batchResponse) {
    try {
      return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(batchResponse));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  public ObjectNode toJson(BatchResponse batchResponse) {
    ObjectNode root = NODE_FACTORY.objectNode();
    for (Map.Entry<String, QueryOutcome> entry : batchResponse.getResponses().entrySet()) {
      root.set(entry.getKey(), toJson(entry.getValue()));
    }
    return root;
  }

  private ObjectNode toJson(QueryOutcome outcome) {
    ObjectNode outcomeNode = NODE_FACTORY.objectNode();
    outcome.getFrame().ifPresent(frame -> outcomeNode.set("frame", toJson(frame)));
    outcome.getError().ifPresent(error -> outcomeNode.set("error", toJson(error)));
    return outcomeNode;
  }

  private ObjectNode toJson(Frame frame) {
    ObjectNode frameNode = NODE_FACTORY.objectNode();
    frameNode.put("refId", frame.getRefId());

    ObjectNode metaNode = frameNode.putObject("meta");
    metaNode.put("executedQueryString", frame.getExecutedQueryString());
    ArrayNode warningsNode = metaNode.putArray("warnings");
    frame.getWarnings().forEach(warningsNode::add);

    ArrayNode fieldsNode = frameNode.putArray("fields");
    ObjectNode timeField = fieldsNode.addObject();
    timeField.put("name", TIME_FIELD_NAME);
    timeField.put("type", "time");
    ArrayNode timeValues = timeField.putArray("values");
    for (Instant timestamp : frame.getTimestamps()) {
      timeValues.add(timestamp.toEpochMilli());
    }

    for (ValueColumn column : frame.getColumns()) {
      fieldsNode.add(toJson(column));
    }
    return frameNode;
  }

  private ObjectNode toJson(ValueColumn column) {
    ObjectNode fieldNode = NODE_FACTORY.objectNode();
    fieldNode.put("name", column.getName());
    fieldNode.put("type", "number");
    ObjectNode labelsNode = fieldNode.putObject("labels");
    column.getLabels().forEach(labelsNode::put);
    ArrayNode valuesNode = fieldNode.putArray("values");
    for (Double value : column.getValues()) {
      valuesNode.add(toJson(value));
    }
    return fieldNode;
  }

  private JsonNode toJson(Double value) {
    if (value == null) {
      return NODE_FACTORY.nullNode();
    }
    if (value.isNaN()) {
      return NODE_FACTORY.textNode("NaN");
    }
    if (value.isInfinite()) {
      return NODE_FACTORY.textNode(value > 0 ? "+Inf" : "-Inf");
    }
    return NODE_FACTORY.numberNode(value);
  }

  private ObjectNode toJson(QueryError error) {
    ObjectNode errorNode = NODE_FACTORY.objectNode();
    errorNode.put("type", error.getType().name());
    errorNode.put("message", error.getMessage());
    return errorNode;
  }
}
