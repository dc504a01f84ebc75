package ca.gc.cra.scribe.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogLevelTest {

  @Test
  void levelsAreOrderedBySeverity() {
    assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.WARNING));
    assertTrue(LogLevel.INFORMATION.isAtLeast(LogLevel.INFORMATION));
    assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFORMATION));
  }

  @Test
  void noneIsNeverEnabledAndDisablesEverything() {
    assertFalse(LogLevel.NONE.isAtLeast(LogLevel.TRACE));
    assertFalse(LogLevel.CRITICAL.isAtLeast(LogLevel.NONE));
  }

  @Test
  void codesMatchTextSinkLayout() {
    assertEquals("TRCE", LogLevel.TRACE.code());
    assertEquals("DBUG", LogLevel.DEBUG.code());
    assertEquals("INFO", LogLevel.INFORMATION.code());
    assertEquals("WARN", LogLevel.WARNING.code());
    assertEquals("FAIL", LogLevel.ERROR.code());
    assertEquals("CRIT", LogLevel.CRITICAL.code());
  }

  @Test
  void parseAcceptsNamesDisplayNamesAndCodes() {
    assertEquals(LogLevel.WARNING, LogLevel.parse("warning"));
    assertEquals(LogLevel.INFORMATION, LogLevel.parse("Information"));
    assertEquals(LogLevel.ERROR, LogLevel.parse("FAIL"));
    assertEquals(LogLevel.DEBUG, LogLevel.parse(" debug "));
  }

  @Test
  void parseRejectsUnknownValues() {
    assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("verbose"));
    assertThrows(IllegalArgumentException.class, () -> LogLevel.parse(" "));
  }
}
