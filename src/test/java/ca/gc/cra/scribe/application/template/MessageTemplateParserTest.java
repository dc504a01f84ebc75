package ca.gc.cra.scribe.application.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageTemplateParserTest {

  @Test
  void substitutesPlaceholdersInOrderAndCapturesProperties() {
    MessageTemplateParser.ParseResult result =
        MessageTemplateParser.parse("User {Id} from {Ip}", 42, "10.0.0.1");

    assertEquals("User 42 from 10.0.0.1", result.message());
    assertEquals(Map.of("Id", 42, "Ip", "10.0.0.1"), result.properties());
    assertEquals(List.of("Id", "Ip"), List.copyOf(result.properties().keySet()));
  }

  @Test
  void templateWithoutArgumentsIsReturnedVerbatim() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse("Waiting for {Job}");

    assertEquals("Waiting for {Job}", result.message());
    assertTrue(result.properties().isEmpty());
  }

  @Test
  void stopsSubstitutingWhenArgumentsRunOut() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse("{A} and {B}", "x");

    assertEquals("x and {B}", result.message());
    assertEquals(Map.of("A", "x"), result.properties());
  }

  @Test
  void extraArgumentsAreIgnored() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse("Only {One}", 1, 2, 3);

    assertEquals("Only 1", result.message());
    assertEquals(1, result.properties().size());
  }

  @Test
  void repeatedNameConsumesArgumentButKeepsFirstValue() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse("{X} then {X}", "first", "second");

    assertEquals("first then second", result.message());
    assertEquals("first", result.properties().get("X"));
  }

  @Test
  void nullArgumentRendersAsNullText() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse("Value {V}", (Object) null);

    assertEquals("Value null", result.message());
    assertTrue(result.properties().containsKey("V"));
  }

  @Test
  void formatSuffixAppliesCaseNumberAndDatePatterns() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse(
        "{Name:u} {Mode:l} {Amount:0.00} {Day:yyyy/MM/dd}",
        "alice", "FAST", new BigDecimal("3.14159"), LocalDate.of(2024, 2, 29));

    assertEquals("ALICE fast 3.14 2024/02/29", result.message());
    assertEquals("alice", result.properties().get("Name"));
    assertTrue(result.properties().containsKey("Amount"));
  }

  @Test
  void invalidFormatFallsBackToPlainValue() {
    MessageTemplateParser.ParseResult result = MessageTemplateParser.parse("{When:qqqq-invalid}", LocalDate.of(2024, 1, 1));

    assertEquals("2024-01-01", result.message());
  }

  @Test
  void argumentWhoseToStringThrowsRendersAsTypeAndHash() {
    Object broken = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("broken toString");
      }
    };

    MessageTemplateParser.ParseResult plain = MessageTemplateParser.parse("Got {Value}", broken);
    MessageTemplateParser.ParseResult formatted = MessageTemplateParser.parse("Got {Value:0.00}", broken);

    String expected = broken.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(broken));
    assertEquals("Got " + expected, plain.message());
    assertEquals("Got " + expected, formatted.message());
    assertSame(broken, plain.properties().get("Value"));
  }

  @Test
  void emptyOrNullTemplateYieldsEmptyMessage() {
    assertEquals("", MessageTemplateParser.parse(null).message());
    assertEquals("", MessageTemplateParser.parse("").message());
  }

  @Test
  void extractPropertyNamesListsDistinctNamesWithoutFormats() {
    assertEquals(List.of("Id", "Total"),
        MessageTemplateParser.extractPropertyNames("{Id} {Total:0.0} {Id}"));
  }
}
