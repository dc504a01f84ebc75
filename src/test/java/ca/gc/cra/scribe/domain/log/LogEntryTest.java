package ca.gc.cra.scribe.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogEntryTest {

  @Test
  void noneLevelCannotBeEmitted() {
    assertThrows(IllegalArgumentException.class,
        () -> LogEntry.of(LogLevel.NONE, "app", "nothing"));
  }

  @Test
  void missingEventIdDefaultsToNone() {
    LogEntry entry = new LogEntry(Instant.EPOCH, LogLevel.INFORMATION, "app", null, "hi", null, null, null, null);

    assertEquals(EventId.NONE, entry.eventId());
    assertTrue(entry.properties().isEmpty());
    assertTrue(entry.scopeProperties().isEmpty());
    assertFalse(entry.hasException());
  }

  @Test
  void propertiesAreDetachedFromCallerMapAndKeepNulls() {
    Map<String, Object> props = new HashMap<>();
    props.put("User", null);
    LogEntry entry = new LogEntry(Instant.EPOCH, LogLevel.INFORMATION, "app", EventId.of(7, "Login"), "hi",
        "hi", props, null, null);
    props.put("Later", 1);

    assertTrue(entry.properties().containsKey("User"));
    assertNull(entry.properties().get("User"));
    assertFalse(entry.properties().containsKey("Later"));
    assertThrows(UnsupportedOperationException.class, () -> entry.properties().put("x", 1));
  }
}
