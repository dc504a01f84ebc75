package ca.gc.cra.scribe.infrastructure.destination;

import ca.gc.cra.scribe.domain.log.LogEntry;
import java.util.ArrayList;
import java.util.List;

/**
 * Threshold-bounded list of pending entries.
 *
 * <p>Not synchronized; callers hold the destination lock when the destination is thread-safe.</p>
 *
 * @since 0.1.0
 */
final class EntryBuffer {
  private final int threshold;
  private List<LogEntry> pending;

  EntryBuffer(int threshold) {
    this.threshold = threshold;
    this.pending = new ArrayList<>(threshold);
  }

  /**
   * Appends one entry.
   *
   * @param entry entry to buffer
   * @return {@code true} when the buffer has reached its threshold
   */
  boolean add(LogEntry entry) {
    pending.add(entry);
    return pending.size() >= threshold;
  }

  /**
   * Swaps the pending list for a fresh one.
   *
   * @return entries in insertion order; empty when nothing is pending
   */
  List<LogEntry> drain() {
    if (pending.isEmpty()) {
      return List.of();
    }
    List<LogEntry> drained = pending;
    pending = new ArrayList<>(threshold);
    return drained;
  }

  int size() {
    return pending.size();
  }
}
