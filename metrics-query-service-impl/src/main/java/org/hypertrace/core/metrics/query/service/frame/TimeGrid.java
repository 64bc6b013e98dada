package org.hypertrace.core.metrics.query.service.frame;

import java.time.Instant;
import java.util.List;

/**
 * Ordered, strictly increasing timestamps (epoch millis) a frame is aligned to. Every value column
 * of the frame has one entry per grid position.
 */
public interface TimeGrid {

  int size();

  long timestampAt(int position);

  /** Position of the given timestamp, or -1 if it is not exactly on the grid. */
  int indexOf(long timestampMillis);

  List<Instant> toInstants();
}
