package ca.gc.cra.scribe.application.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LogScopeTest {

  @AfterEach
  void noScopeLeaks() {
    assertFalse(LogScope.isActive(), "test left a scope open");
  }

  @Test
  void innerScopeOverridesOuterAndRestoresOnClose() {
    try (LogScope outer = LogScope.begin(Map.of("A", 1))) {
      try (LogScope inner = LogScope.begin(Map.of("A", 2, "B", 3))) {
        assertEquals(Map.of("A", 2, "B", 3), LogScope.currentProperties());
      }
      assertEquals(Map.of("A", 1), LogScope.currentProperties());
    }
    assertTrue(LogScope.currentProperties().isEmpty());
  }

  @Test
  void closingOutOfOrderSkipsClosedFrames() {
    LogScope outer = LogScope.begin("Outer", "o");
    LogScope inner = LogScope.begin("Inner", "i");

    outer.close();
    assertEquals(Map.of("Inner", "i"), LogScope.currentProperties());

    inner.close();
    assertTrue(LogScope.currentProperties().isEmpty());
  }

  @Test
  void closeIsIdempotent() {
    LogScope outer = LogScope.begin("A", 1);
    LogScope inner = LogScope.begin("B", 2);
    inner.close();
    inner.close();

    assertEquals(Map.of("A", 1), LogScope.currentProperties());
    outer.close();
  }

  @Test
  void stateKindsAreConvertedToProperties() {
    try (LogScope text = LogScope.begin("checkout")) {
      assertEquals(Map.of("Scope", "checkout"), LogScope.currentProperties());
    }
    try (LogScope state = LogScope.begin((ScopeState) () -> Map.of("Order", 99))) {
      assertEquals(Map.of("Order", 99), LogScope.currentProperties());
    }
    try (LogScope pairs = LogScope.begin(List.of(Map.entry("K", "v")))) {
      assertEquals(Map.of("K", "v"), LogScope.currentProperties());
    }
    try (LogScope other = LogScope.begin(42)) {
      assertEquals(Map.of("State", 42), LogScope.currentProperties());
    }
  }

  @Test
  void scopesAreIsolatedPerThreadUnlessWrapped() throws Exception {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try (LogScope scope = LogScope.begin("Request", "r-1")) {
      AtomicReference<Map<String, Object>> plain = new AtomicReference<>();
      AtomicReference<Map<String, Object>> wrapped = new AtomicReference<>();

      Future<?> first = pool.submit(() -> plain.set(LogScope.currentProperties()));
      first.get();
      Future<?> second = pool.submit(LogScope.wrap(() -> wrapped.set(LogScope.currentProperties())));
      second.get();

      assertTrue(plain.get().isEmpty());
      assertEquals(Map.of("Request", "r-1"), wrapped.get());
      Future<Boolean> after = pool.submit(LogScope::isActive);
      assertFalse(after.get());
    } finally {
      pool.shutdownNow();
    }
  }
}
