package ca.gc.cra.scribe.infrastructure.destination.console;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ConsoleLogDestinationTest {

  @Test
  void writesPlainLinesWithoutColors() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ConsoleLogDestination console = new ConsoleLogDestination(
        new PrintStream(bytes, true, StandardCharsets.UTF_8), false, DestinationOptions.defaults());

    console.writeLog(LogEntry.of(LogLevel.INFORMATION, "app", "hello"));

    String out = bytes.toString(StandardCharsets.UTF_8);
    assertTrue(out.contains("[INFO] app: hello"));
    assertFalse(out.contains("\u001B["));
    assertEquals("console", console.name());
  }

  @Test
  void colorsFollowSeverity() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ConsoleLogDestination console = new ConsoleLogDestination(
        new PrintStream(bytes, true, StandardCharsets.UTF_8), true, DestinationOptions.defaults());

    console.writeLog(LogEntry.of(LogLevel.INFORMATION, "app", "plain"));
    console.writeLog(LogEntry.of(LogLevel.WARNING, "app", "warn"));
    console.writeLog(LogEntry.of(LogLevel.ERROR, "app", "error"));
    console.writeLog(LogEntry.of(LogLevel.CRITICAL, "app", "critical"));

    String[] lines = bytes.toString(StandardCharsets.UTF_8).split(System.lineSeparator());
    assertFalse(lines[0].startsWith("\u001B["));
    assertTrue(lines[1].startsWith("\u001B[33m") && lines[1].endsWith("\u001B[0m"));
    assertTrue(lines[2].startsWith("\u001B[31m"));
    assertTrue(lines[3].startsWith("\u001B[1;31m"));
  }

  @Test
  void asyncConsoleWritesBufferedEntriesOnClose() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    AsyncConsoleLogDestination console = new AsyncConsoleLogDestination(
        new PrintStream(bytes, true, StandardCharsets.UTF_8), false,
        DestinationOptions.of(WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE));

    console.writeLogAsync(LogEntry.of(LogLevel.DEBUG, "app", "queued"));
    assertEquals(0, bytes.size());

    console.closeAsync().join();
    assertTrue(bytes.toString(StandardCharsets.UTF_8).contains("[DBUG] app: queued"));
  }
}
