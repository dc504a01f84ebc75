package ca.gc.cra.scribe.infrastructure.destination.file;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.testsupport.JsonTestSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileLogDestinationTest {

  @TempDir Path tempDir;

  @Test
  void writesOneJsonObjectPerLine() throws IOException {
    Path file = tempDir.resolve("app.json");
    JsonFileLogDestination destination = new JsonFileLogDestination(file, true, DestinationOptions.defaults());

    destination.writeLog(new LogEntry(Instant.EPOCH, LogLevel.WARNING, "disk", EventId.of(2), "Low space",
        "Low {What}", Map.of("What", "space"), Map.of("Host", "h1"), null));
    destination.writeLog(LogEntry.of(LogLevel.INFORMATION, "disk", "ok"));
    destination.close();

    List<String> lines = Files.readAllLines(file);
    assertEquals(2, lines.size());
    Map<String, Object> first = JsonTestSupport.parseObject(lines.get(0));
    assertEquals("Warning", first.get("@level"));
    assertEquals("space", first.get("@What"));
    assertEquals("h1", first.get("scope.Host"));
    assertEquals("ok", JsonTestSupport.parseObject(lines.get(1)).get("@message"));
    assertEquals("json:app.json", destination.name());
  }

  @Test
  void asyncVariantWritesOnClose() throws IOException {
    Path file = tempDir.resolve("async.json");
    AsyncJsonFileLogDestination destination =
        new AsyncJsonFileLogDestination(file, false, DestinationOptions.defaults());

    for (int i = 0; i < 5; i++) {
      destination.writeLogAsync(LogEntry.of(LogLevel.INFORMATION, "app", "n" + i));
    }
    destination.closeAsync().join();

    List<String> lines = Files.readAllLines(file);
    assertEquals(5, lines.size());
    assertEquals("n4", JsonTestSupport.parseObject(lines.get(4)).get("@message"));
  }
}
