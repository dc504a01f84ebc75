package ca.gc.cra.scribe.infrastructure.destination.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.ExceptionInfo;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.testsupport.JsonTestSupport;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLogRecordWriterTest {
  private static final Instant AT = Instant.parse("2024-03-09T07:05:03.042Z");

  @Test
  void writesStandardFieldsPropertiesAndScope() throws IOException {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("UserId", 42);
    props.put("Tags", List.of("a", "b"));
    LogEntry entry = new LogEntry(AT, LogLevel.INFORMATION, "auth", EventId.of(10, "Login"),
        "User 42 logged in", "User {UserId} logged in", props, Map.of("RequestId", "r-1"), null);

    String line = JsonLogRecordWriter.toJsonLine(entry);
    Map<String, Object> json = JsonTestSupport.parseObject(line);

    assertFalse(line.contains("\n"));
    assertEquals("2024-03-09T07:05:03.042Z", json.get("@timestamp"));
    assertEquals("Information", json.get("@level"));
    assertEquals("auth", json.get("@category"));
    assertEquals("User 42 logged in", json.get("@message"));
    assertEquals("User {UserId} logged in", json.get("@messageTemplate"));
    assertEquals(Map.of("id", 10, "name", "Login"), json.get("eventId"));
    assertEquals(42, json.get("@UserId"));
    assertEquals(List.of("a", "b"), json.get("@Tags"));
    assertEquals("r-1", json.get("scope.RequestId"));
    assertFalse(json.containsKey("exception"));
  }

  @Test
  void propertyCollidingWithStandardFieldIsRenamed() throws IOException {
    LogEntry entry = new LogEntry(AT, LogLevel.INFORMATION, "app", EventId.NONE, "m", "{message}",
        Map.of("message", "shadow"), null, null);

    Map<String, Object> json = JsonTestSupport.parseObject(JsonLogRecordWriter.toJsonLine(entry));

    assertEquals("m", json.get("@message"));
    assertEquals("shadow", json.get("@prop.message"));
  }

  @Test
  void renamedPropertyDoesNotOverwriteAnEarlierPrefixedOne() throws IOException {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("prop.timestamp", "explicit");
    props.put("timestamp", "shadow");
    LogEntry entry = new LogEntry(AT, LogLevel.INFORMATION, "app", EventId.NONE, "m", null, props, null, null);

    String line = JsonLogRecordWriter.toJsonLine(entry);
    Map<String, Object> json = JsonTestSupport.parseObject(line);

    assertEquals("2024-03-09T07:05:03.042Z", json.get("@timestamp"));
    assertEquals("explicit", json.get("@prop.timestamp"));
    assertEquals("shadow", json.get("@prop.timestamp_2"));
    assertEquals(line.indexOf("\"@prop.timestamp\""), line.lastIndexOf("\"@prop.timestamp\""));
  }

  @Test
  void exceptionIsNestedWithInnerException() throws IOException {
    ExceptionInfo info = ExceptionInfo.from(new IllegalStateException("outer", new IllegalArgumentException("inner")));
    LogEntry entry = new LogEntry(AT, LogLevel.ERROR, "app", EventId.NONE, "failed", null, null, null, info);

    Map<String, Object> json = JsonTestSupport.parseObject(JsonLogRecordWriter.toJsonLine(entry));

    @SuppressWarnings("unchecked")
    Map<String, Object> exception = (Map<String, Object>) json.get("exception");
    assertEquals("java.lang.IllegalStateException", exception.get("type"));
    assertEquals("outer", exception.get("message"));
    assertTrue(((String) exception.get("stackTrace")).contains("at "));
    @SuppressWarnings("unchecked")
    Map<String, Object> inner = (Map<String, Object>) exception.get("innerException");
    assertEquals("inner", inner.get("message"));
    assertNull(inner.get("innerException"));
    assertNull(json.get("@messageTemplate"));
  }

  @Test
  void propertiesJsonRendersValuesByTypeAndNullForEmpty() throws IOException {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("flag", true);
    props.put("ratio", 0.5);
    props.put("when", Instant.parse("2024-01-01T00:00:00Z"));
    props.put("nested", Map.of("k", new int[] {1, 2}));
    props.put("missing", null);
    props.put("other", new StringBuilder("sb"));

    Map<String, Object> json = JsonTestSupport.parseObject(JsonLogRecordWriter.propertiesJson(props));

    assertEquals(true, json.get("flag"));
    assertEquals(0.5, json.get("ratio"));
    assertEquals("2024-01-01T00:00:00Z", json.get("when"));
    assertEquals(Map.of("k", List.of(1, 2)), json.get("nested"));
    assertTrue(json.containsKey("missing"));
    assertEquals("sb", json.get("other"));
    assertNull(JsonLogRecordWriter.propertiesJson(Map.of()));
  }
}
