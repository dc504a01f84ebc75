package ca.gc.cra.scribe.infrastructure.destination.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.ExceptionInfo;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LogLineFormatterTest {
  private static final Instant AT = Instant.parse("2024-03-09T07:05:03.042Z");

  @Test
  void formatsTimestampCodeCategoryAndMessage() {
    LogEntry entry = new LogEntry(AT, LogLevel.WARNING, "Orders.Api", EventId.NONE, "Slow response", null,
        null, null, null);

    assertEquals("[2024-03-09T07:05:03.042Z] [WARN] Orders.Api: Slow response", LogLineFormatter.format(entry));
  }

  @Test
  void appendsExceptionOnFollowingLines() {
    LogEntry entry = new LogEntry(AT, LogLevel.ERROR, "app", EventId.NONE, "Failed", null, null, null,
        ExceptionInfo.from(new IllegalStateException("broken")));

    String line = LogLineFormatter.format(entry);

    assertTrue(line.startsWith("[2024-03-09T07:05:03.042Z] [FAIL] app: Failed" + System.lineSeparator()
        + "java.lang.IllegalStateException: broken"));
  }
}
