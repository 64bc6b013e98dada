package org.hypertrace.core.metrics.query.service.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

/** Outcomes of a batch keyed by reference id, iterated in the order the queries were submitted. */
@EqualsAndHashCode
@ToString
public class BatchResponse {
  private final Map<String, QueryOutcome> responses;

  public BatchResponse(@NonNull Map<String, QueryOutcome> responses) {
    this.responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
  }

  public Map<String, QueryOutcome> getResponses() {
    return responses;
  }

  public Optional<QueryOutcome> get(String refId) {
    return Optional.ofNullable(responses.get(refId));
  }

  public int size() {
    return responses.size();
  }

  public long getErrorCount() {
    return responses.values().stream().filter(outcome -> !outcome.isSuccess()).count();
  }
}
