package ca.gc.cra.scribe.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExceptionInfoTest {

  @Test
  void capturesTypeMessageAndCauseChain() {
    IllegalStateException failure = new IllegalStateException("outer", new IOException("disk gone"));

    ExceptionInfo info = ExceptionInfo.from(failure);

    assertEquals(IllegalStateException.class.getName(), info.type());
    assertEquals("outer", info.message());
    assertTrue(info.stackTrace().contains("at "));
    assertNotNull(info.cause());
    assertEquals(IOException.class.getName(), info.cause().type());
    assertEquals("disk gone", info.cause().message());
    assertNull(info.cause().cause());
  }

  @Test
  void renderIncludesFullTraceWithCauses() {
    ExceptionInfo info = ExceptionInfo.from(new RuntimeException("boom", new IOException("root")));

    String rendered = info.render();

    assertTrue(rendered.startsWith("java.lang.RuntimeException: boom"));
    assertTrue(rendered.contains("Caused by: java.io.IOException: root"));
  }

  @Test
  void nullThrowableYieldsNull() {
    assertNull(ExceptionInfo.from(null));
  }

  @Test
  void selfReferencingCauseDoesNotLoop() {
    Exception first = new Exception("first");
    Exception second = new Exception("second", first);
    first.initCause(second);

    ExceptionInfo info = ExceptionInfo.from(second);

    assertEquals("first", info.cause().message());
    assertNull(info.cause().cause());
  }
}
