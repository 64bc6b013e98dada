package org.hypertrace.core.metrics.query.service.api;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

/** Either the frame of a query or the error that stopped it, never both. */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class QueryOutcome {
  private final Frame frame;
  private final QueryError error;

  public static QueryOutcome success(@NonNull Frame frame) {
    return new QueryOutcome(frame, null);
  }

  public static QueryOutcome failure(@NonNull QueryError error) {
    return new QueryOutcome(null, error);
  }

  public boolean isSuccess() {
    return frame != null;
  }

  public Optional<Frame> getFrame() {
    return Optional.ofNullable(frame);
  }

  public Optional<QueryError> getError() {
    return Optional.ofNullable(error);
  }
}
