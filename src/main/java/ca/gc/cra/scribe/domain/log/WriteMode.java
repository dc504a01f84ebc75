package ca.gc.cra.scribe.domain.log;

/**
 * <strong>What:</strong> Persistence discipline of a destination.
 * <p><strong>Why:</strong> Lets operators trade latency for fewer I/O calls per entry.</p>
 * <p><strong>Role:</strong> Configuration enumeration consumed by destination base classes.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum WriteMode {
  /** Persist every entry the moment it arrives. */
  IMMEDIATE,
  /** Accumulate entries and persist them when the threshold is reached or on flush. */
  BUFFERED
}
