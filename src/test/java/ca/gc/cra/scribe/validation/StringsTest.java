package ca.gc.cra.scribe.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsValue() {
    assertEquals("orders", Strings.requireNonBlank("category", "  orders "));
  }

  @Test
  void requireNonBlankRejectsBlankNullAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("category", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("category", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("category", "a\u0000b"));
  }
}
