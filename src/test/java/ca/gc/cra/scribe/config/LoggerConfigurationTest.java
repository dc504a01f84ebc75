package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.pipeline.ScribeLoggerFactory;
import ca.gc.cra.scribe.application.port.StructuredLogger;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import ca.gc.cra.scribe.testsupport.JsonTestSupport;
import ca.gc.cra.scribe.testsupport.RecordingDestination;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggerConfigurationTest {

  @TempDir Path tempDir;

  @Test
  void buildWithoutDestinationsFails() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> LoggerConfiguration.create().build());

    assertEquals("At least one log destination must be configured.", ex.getMessage());
  }

  @Test
  void invalidPathsAndSizesAreRejectedImmediately() {
    LoggerConfiguration config = LoggerConfiguration.create();

    assertThrows(IllegalArgumentException.class, () -> config.addPlainText("  "));
    assertThrows(IllegalArgumentException.class, () -> config.addJson(null));
    assertThrows(IllegalArgumentException.class, () -> config.setBufferSize(0));
    assertThrows(IllegalArgumentException.class, () -> config.addSqlite(
        tempDir.resolve("x.db").toString(), WriteMode.IMMEDIATE, ThreadSafety.THREAD_SAFE, true, 0));
  }

  @Test
  void everyConfiguredDestinationReceivesEntries() throws IOException, SQLException {
    Path text = tempDir.resolve("logs/app.log");
    Path json = tempDir.resolve("logs/app.json");
    Path db = tempDir.resolve("logs/app.db");
    ByteArrayOutputStream consoleBytes = new ByteArrayOutputStream();

    ScribeLoggerFactory factory = LoggerConfiguration.create()
        .setMinimumLevel(LogLevel.DEBUG)
        .addConsole(new PrintStream(consoleBytes, true, StandardCharsets.UTF_8), WriteMode.IMMEDIATE,
            ThreadSafety.THREAD_SAFE, false)
        .addPlainText(text.toString())
        .addJson(json.toString())
        .addSqlite(db.toString())
        .build();
    StructuredLogger logger = factory.logger("checkout");

    logger.trace("filtered");
    logger.debug("Cart {CartId} has {Count} items", "c-1", 3);
    factory.close();

    assertTrue(consoleBytes.toString(StandardCharsets.UTF_8).contains("[DBUG] checkout: Cart c-1 has 3 items"));
    List<String> lines = Files.readAllLines(text);
    assertEquals(1, lines.size());
    assertEquals(3, JsonTestSupport.parseObject(Files.readAllLines(json).get(0)).get("@Count"));
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM LogEntries")) {
      assertTrue(rs.next());
      assertEquals(1, rs.getInt(1));
    }
  }

  @Test
  void bufferSizeAppliesToBufferedDestinations() throws IOException {
    Path text = tempDir.resolve("buffered.log");
    ScribeLoggerFactory factory = LoggerConfiguration.create()
        .setBufferSize(2)
        .addPlainText(text.toString(), WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, false)
        .build();
    StructuredLogger logger = factory.logger("app");

    logger.info("one");
    assertEquals(0, Files.readAllLines(text).size());
    logger.info("two");
    assertEquals(2, Files.readAllLines(text).size());
    factory.close();
  }

  @Test
  void customDestinationIsOwnedByFactory() {
    RecordingDestination custom = new RecordingDestination("custom");
    ScribeLoggerFactory factory = LoggerConfiguration.create().addDestination(custom).build();

    factory.logger("app").info("hello");
    factory.close();

    assertEquals(List.of("hello"), custom.messages());
    assertEquals(1, custom.closeCount());
  }
}
