package org.hypertrace.core.metrics.query.service;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse.PromQLData;

public class MetricsQueryTestUtils {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

  public static String readResource(String fileName) {
    URL fileUrl =
        requireNonNull(MetricsQueryTestUtils.class.getClassLoader().getResource(fileName));
    try {
      return new String(Files.readAllBytes(Paths.get(fileUrl.getFile())), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static JsonNode readJsonResource(String fileName) {
    return readJson(readResource(fileName));
  }

  public static JsonNode readJson(String json) {
    try {
      return OBJECT_MAPPER.readTree(json);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** A successful response carrying the given result, e.g. {@code [{"metric": {...}, ...}]}. */
  public static PromQLMetricResponse successResponse(String resultType, String resultJson) {
    return PromQLMetricResponse.builder()
        .status("success")
        .data(PromQLData.builder().resultType(resultType).result(readJson(resultJson)).build())
        .build();
  }
}
