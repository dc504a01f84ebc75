package ca.gc.cra.scribe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.testsupport.RecordingDestination;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScribeLoggerFactoryTest {

  @Test
  void loggersAreCachedPerCategory() {
    ScribeLoggerFactory factory =
        new ScribeLoggerFactory(LogLevel.INFORMATION, List.of(new RecordingDestination("memory")), null);

    assertSame(factory.logger("orders"), factory.logger("orders"));
    assertNotSame(factory.logger("orders"), factory.logger("billing"));
    assertEquals(ScribeLoggerFactoryTest.class.getName(), factory.logger(ScribeLoggerFactoryTest.class).category());
    factory.close();
  }

  @Test
  void loggersShareDestinationsAndMinimumLevel() {
    RecordingDestination sink = new RecordingDestination("memory");
    ScribeLoggerFactory factory = new ScribeLoggerFactory(LogLevel.WARNING, List.of(sink), null);

    factory.logger("a").info("ignored");
    factory.logger("a").warn("from a");
    factory.logger("b").error("from b");

    assertEquals(List.of("from a", "from b"), sink.messages());
    assertEquals("b", sink.entries().get(1).category());
    factory.close();
  }

  @Test
  void closeFlushesThenClosesDestinationsOnce() {
    RecordingDestination sink = new RecordingDestination("memory");
    ScribeLoggerFactory factory = new ScribeLoggerFactory(LogLevel.TRACE, List.of(sink), null);
    factory.logger("a");
    factory.logger("b");

    factory.close();
    factory.close();

    assertEquals(1, sink.closeCount());
    assertEquals(3, sink.flushCount());
    assertThrows(IllegalStateException.class, () -> factory.logger("c"));
  }

  @Test
  void blankCategoryIsRejected() {
    ScribeLoggerFactory factory =
        new ScribeLoggerFactory(LogLevel.TRACE, List.of(new RecordingDestination("memory")), null);

    assertThrows(IllegalArgumentException.class, () -> factory.logger("  "));
    factory.close();
  }
}
