package ca.gc.cra.scribe.domain.log;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable capture of a {@link Throwable} and its cause chain.
 * <p><strong>Why:</strong> Entries are buffered and serialized later, possibly on other threads; capturing text at
 * log time keeps the entry immutable even if the throwable is mutated afterwards.</p>
 * <p><strong>Role:</strong> Domain value object carried by {@link LogEntry}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 * <p><strong>Performance:</strong> Renders the stack once per logged exception.</p>
 *
 * @param type fully qualified class name of the throwable
 * @param message throwable message; may be {@code null}
 * @param stackTrace frames of this throwable only, one {@code at ...} per line
 * @param cause captured cause; {@code null} at the end of the chain
 * @param fullText complete {@link Throwable#printStackTrace()} output including causes
 * @since 0.1.0
 */
public record ExceptionInfo(
    String type, String message, String stackTrace, ExceptionInfo cause, String fullText) {

  private static final int MAX_CAUSE_DEPTH = 32;

  public ExceptionInfo {
    Objects.requireNonNull(type, "type");
    stackTrace = stackTrace == null ? "" : stackTrace;
    fullText = fullText == null ? "" : fullText;
  }

  /**
   * Captures the supplied throwable and its causes.
   *
   * @param throwable throwable to capture; {@code null} yields {@code null}
   * @return captured exception or {@code null}
   */
  public static ExceptionInfo from(Throwable throwable) {
    if (throwable == null) {
      return null;
    }
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    return capture(throwable, seen, 0);
  }

  private static ExceptionInfo capture(Throwable throwable, Set<Throwable> seen, int depth) {
    seen.add(throwable);
    Throwable next = throwable.getCause();
    ExceptionInfo cause = null;
    if (next != null && depth < MAX_CAUSE_DEPTH && !seen.contains(next)) {
      cause = capture(next, seen, depth + 1);
    }
    return new ExceptionInfo(
        throwable.getClass().getName(),
        throwable.getMessage(),
        renderFrames(throwable.getStackTrace()),
        cause,
        depth == 0 ? renderFull(throwable) : "");
  }

  private static String renderFrames(StackTraceElement[] frames) {
    StringBuilder out = new StringBuilder(frames.length * 64);
    for (int i = 0; i < frames.length; i++) {
      if (i > 0) {
        out.append(System.lineSeparator());
      }
      out.append("   at ").append(frames[i]);
    }
    return out.toString();
  }

  private static String renderFull(Throwable throwable) {
    StringWriter buffer = new StringWriter(512);
    try (PrintWriter writer = new PrintWriter(buffer)) {
      throwable.printStackTrace(writer);
    }
    String text = buffer.toString();
    return text.endsWith(System.lineSeparator())
        ? text.substring(0, text.length() - System.lineSeparator().length())
        : text;
  }

  /**
   * Returns the text written by plain-text sinks: the full trace when available, otherwise
   * {@code type: message}.
   *
   * @return printable exception text
   */
  public String render() {
    if (!fullText.isEmpty()) {
      return fullText;
    }
    return message == null ? type : type + ": " + message;
  }
}
