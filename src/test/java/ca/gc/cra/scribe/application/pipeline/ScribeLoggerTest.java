package ca.gc.cra.scribe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.port.LogDestination;
import ca.gc.cra.scribe.application.scope.LogScope;
import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.destination.DestinationDiagnostics;
import ca.gc.cra.scribe.testsupport.DiagnosticsCapture;
import ca.gc.cra.scribe.testsupport.RecordingDestination;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScribeLoggerTest {

  @Test
  void entriesBelowMinimumLevelAreDiscarded() {
    RecordingDestination sink = new RecordingDestination("memory");
    ScribeLogger logger = new ScribeLogger("app", LogLevel.WARNING, List.of(sink));

    logger.debug("hidden");
    logger.info("hidden");
    logger.warn("shown {N}", 1);
    logger.error("shown too");

    assertEquals(List.of("shown 1", "shown too"), sink.messages());
    assertFalse(logger.isEnabled(LogLevel.INFORMATION));
    assertTrue(logger.isEnabled(LogLevel.CRITICAL));
    assertFalse(logger.isEnabled(LogLevel.NONE));
  }

  @Test
  void noneMinimumLevelDisablesLogging() {
    RecordingDestination sink = new RecordingDestination("memory");
    ScribeLogger logger = new ScribeLogger("app", LogLevel.NONE, List.of(sink));

    logger.critical("never");

    assertTrue(sink.entries().isEmpty());
  }

  @Test
  void everyDestinationReceivesTheSameEntry() {
    RecordingDestination first = new RecordingDestination("first");
    RecordingDestination second = new RecordingDestination("second");
    ScribeLogger logger = new ScribeLogger("app", LogLevel.TRACE, List.of(first, second));

    logger.log(LogLevel.INFORMATION, EventId.of(3, "Start"), null, "Started {Service}", "billing");

    LogEntry entry = first.entries().get(0);
    assertEquals(entry, second.entries().get(0));
    assertEquals(EventId.of(3, "Start"), entry.eventId());
    assertEquals(Map.of("Service", "billing"), entry.properties());
  }

  @Test
  void exceptionIsAttachedToEntry() {
    RecordingDestination sink = new RecordingDestination("memory");
    ScribeLogger logger = new ScribeLogger("app", LogLevel.TRACE, List.of(sink));

    logger.error(new IllegalArgumentException("bad input"), "Request {Id} failed", 9);

    LogEntry entry = sink.entries().get(0);
    assertTrue(entry.hasException());
    assertEquals("bad input", entry.exception().message());
  }

  @Test
  void scopePropertiesFlowIntoEntries() {
    RecordingDestination sink = new RecordingDestination("memory");
    ScribeLogger logger = new ScribeLogger("app", LogLevel.TRACE, List.of(sink));

    try (LogScope scope = logger.beginScope(Map.of("RequestId", "r-7"))) {
      try (LogScope template = logger.beginTemplateScope("Order {OrderId}", 55)) {
        logger.info("inside");
      }
    }
    logger.info("outside");

    assertEquals(Map.of("RequestId", "r-7", "OrderId", 55), sink.entries().get(0).scopeProperties());
    assertTrue(sink.entries().get(1).scopeProperties().isEmpty());
  }

  @Test
  void failingDestinationDoesNotStopOthersOrThrow() {
    RecordingDestination broken = new RecordingDestination("broken").failWrites();
    RecordingDestination healthy = new RecordingDestination("healthy");
    ScribeLogger logger = new ScribeLogger("app", LogLevel.TRACE, List.of(broken, healthy), true,
        new LogEntryFactory(), new DestinationDiagnostics("logger:app", null));

    try (DiagnosticsCapture capture = DiagnosticsCapture.start()) {
      assertDoesNotThrow(() -> logger.info("still delivered"));

      assertEquals(List.of("still delivered"), healthy.messages());
      assertTrue(capture.contains("broken refused entry"));
    }
  }

  @Test
  void closeReleasesOwnedDestinationsButOnlyFlushesSharedOnes() {
    RecordingDestination owned = new RecordingDestination("owned");
    RecordingDestination shared = new RecordingDestination("shared");
    ScribeLogger owner = new ScribeLogger("a", LogLevel.TRACE, List.<LogDestination>of(owned));
    ScribeLogger borrower = new ScribeLogger("b", LogLevel.TRACE, List.<LogDestination>of(shared), false,
        new LogEntryFactory(), new DestinationDiagnostics("logger:b", null));

    owner.close();
    borrower.close();

    assertEquals(1, owned.closeCount());
    assertEquals(0, shared.closeCount());
    assertEquals(1, shared.flushCount());
  }
}
