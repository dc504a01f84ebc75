package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

  @Test
  void defaultsApplyWhenKeysAreMissing() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of());

    assertEquals(PipelineConfig.Mode.SYNC, config.mode());
    assertEquals(LogLevel.INFORMATION, config.minimumLevel());
    assertEquals(100, config.bufferSize());
    assertEquals(1000, config.queueCapacity());
    assertEquals(Duration.ofMillis(50), config.enqueueTimeout());
    assertEquals(PipelineConfig.MetricsMode.NONE, config.metrics());
    assertTrue(config.destinations().isEmpty());
  }

  @Test
  void parsesTopLevelAndDestinationKeys() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of(
        "mode", "async",
        "minimumLevel", "warning",
        "queueCapacity", "64",
        "enqueueTimeoutMillis", "250",
        "destinations.screen.kind", "console",
        "destinations.screen.colors", "false",
        "destinations.store.kind", "sqlite",
        "destinations.store.path", "logs/app.db",
        "destinations.store.poolSize", "4",
        "destinations.store.threadSafety", "not-thread-safe"));

    assertEquals(PipelineConfig.Mode.ASYNC, config.mode());
    assertEquals(LogLevel.WARNING, config.minimumLevel());
    assertEquals(64, config.queueCapacity());
    assertEquals(Duration.ofMillis(250), config.enqueueTimeout());
    assertEquals(2, config.destinations().size());

    PipelineConfig.DestinationConfig screen = config.destinations().get(0);
    assertEquals("screen", screen.name());
    assertEquals(PipelineConfig.Kind.CONSOLE, screen.kind());
    assertEquals(WriteMode.IMMEDIATE, screen.writeMode());
    assertFalse(screen.colors());

    PipelineConfig.DestinationConfig store = config.destinations().get(1);
    assertEquals(PipelineConfig.Kind.SQLITE, store.kind());
    assertEquals(WriteMode.BUFFERED, store.writeMode());
    assertEquals(ThreadSafety.NOT_THREAD_SAFE, store.threadSafety());
    assertEquals(4, store.poolSize());
    assertTrue(store.createIfNotExists());
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("mode", "batch")));
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("bufferSize", "ten")));
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("queueCapacity", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("destinations.a.kind", "plain")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("destinations.a.path", "x.log")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("destinations.a.kind", "console", "destinations.a.append", "maybe")));
  }
}
