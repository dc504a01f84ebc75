package ca.gc.cra.scribe.domain.log;

/**
 * Identifier used to correlate repeated occurrences of the same logical event.
 *
 * @param id small numeric identifier; {@code 0} when unspecified
 * @param name optional symbolic name; may be {@code null}
 * @since 0.1.0
 */
public record EventId(int id, String name) {
  /** Event identifier used when the call site does not supply one. */
  public static final EventId NONE = new EventId(0, null);

  /**
   * Creates an identifier without a symbolic name.
   *
   * @param id numeric identifier
   * @return event identifier
   */
  public static EventId of(int id) {
    return new EventId(id, null);
  }

  /**
   * Creates an identifier with a symbolic name.
   *
   * @param id numeric identifier
   * @param name symbolic name
   * @return event identifier
   */
  public static EventId of(int id, String name) {
    return new EventId(id, name);
  }
}
