package ca.gc.cra.scribe.domain.log;

/**
 * <strong>What:</strong> Synchronization mode of a destination.
 * <p><strong>Why:</strong> Single-threaded callers can skip locking overhead.</p>
 * <p><strong>Role:</strong> Configuration enumeration consumed by destination base classes.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ThreadSafety {
  /** Internal mutual exclusion guarantees one writer or flusher at a time. */
  THREAD_SAFE,
  /** Caller guarantees single-threaded use. */
  NOT_THREAD_SAFE
}
