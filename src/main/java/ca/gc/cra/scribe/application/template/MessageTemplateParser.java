package ca.gc.cra.scribe.application.template;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Renders {@code {Name}} / {@code {Name:format}} message templates and extracts the bound
 * argument values as named properties.
 * <p><strong>Why:</strong> Structured sinks keep the raw argument values while text sinks only need the rendered
 * message; both come from one pass over the template.</p>
 * <p><strong>Role:</strong> Pure application helper invoked by loggers after the level check.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Replace placeholders left to right, consuming one positional argument per occurrence.</li>
 *   <li>Bind each clean placeholder name to its original argument; the first occurrence of a name wins.</li>
 *   <li>Leave placeholders unresolved once arguments run out.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; the compiled pattern is immutable.</p>
 * <p><strong>Performance:</strong> Single regex scan of the template; allocation proportional to output size.</p>
 * <p><strong>Observability:</strong> None; formatting failures silently fall back to the plain value, and a value
 * whose {@code toString()} throws renders as {@code type@hash}.</p>
 *
 * @implNote Format suffixes {@code l}/{@code u} change case of the rendered text only. Other suffixes are
 * {@link DecimalFormat} patterns for numbers and {@link DateTimeFormatter} patterns for temporals; values of any
 * other type ignore the suffix.
 * @since 0.1.0
 */
public final class MessageTemplateParser {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}]+)\\}");
  private static final String NULL_TEXT = "null";

  private MessageTemplateParser() {
    // Utility
  }

  /**
   * Renders the template and extracts properties.
   *
   * @param template message template; {@code null} is treated as empty
   * @param args positional arguments; {@code null} is treated as no arguments
   * @return rendered message and property map
   */
  public static ParseResult parse(String template, Object... args) {
    if (template == null || template.isEmpty()) {
      return ParseResult.EMPTY;
    }
    Object[] values = args == null ? new Object[0] : args;
    Matcher matcher = PLACEHOLDER.matcher(template);
    Map<String, Object> properties = new LinkedHashMap<>();
    StringBuilder rendered = new StringBuilder(template.length() + 16 * values.length);
    int cursor = 0;
    int argIndex = 0;
    while (argIndex < values.length && matcher.find()) {
      String token = matcher.group(1);
      Object value = values[argIndex++];
      properties.putIfAbsent(cleanName(token), value);
      rendered.append(template, cursor, matcher.start());
      rendered.append(format(value, token));
      cursor = matcher.end();
    }
    if (cursor == 0 && properties.isEmpty()) {
      return new ParseResult(template, Map.of());
    }
    rendered.append(template, cursor, template.length());
    return new ParseResult(rendered.toString(), Collections.unmodifiableMap(properties));
  }

  /**
   * Lists the distinct clean placeholder names in template order.
   *
   * @param template message template; may be {@code null}
   * @return distinct property names (format suffixes removed)
   */
  public static List<String> extractPropertyNames(String template) {
    if (template == null || template.isEmpty()) {
      return List.of();
    }
    List<String> names = new ArrayList<>();
    Matcher matcher = PLACEHOLDER.matcher(template);
    while (matcher.find()) {
      String name = cleanName(matcher.group(1));
      if (!names.contains(name)) {
        names.add(name);
      }
    }
    return List.copyOf(names);
  }

  private static String cleanName(String token) {
    int colon = token.indexOf(':');
    return colon >= 0 ? token.substring(0, colon) : token;
  }

  private static String format(Object value, String token) {
    if (value == null) {
      return NULL_TEXT;
    }
    int colon = token.indexOf(':');
    if (colon < 0 || colon == token.length() - 1) {
      return text(value);
    }
    return applyFormat(value, token.substring(colon + 1));
  }

  private static String applyFormat(Object value, String pattern) {
    try {
      if (pattern.equalsIgnoreCase("l")) {
        return text(value).toLowerCase(Locale.ROOT);
      }
      if (pattern.equalsIgnoreCase("u")) {
        return text(value).toUpperCase(Locale.ROOT);
      }
      if (value instanceof Number number) {
        return formatNumber(number, pattern);
      }
      if (value instanceof TemporalAccessor temporal) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).format(temporal);
      }
      return text(value);
    } catch (RuntimeException ex) {
      return text(value);
    }
  }

  private static String text(Object value) {
    try {
      return String.valueOf(value);
    } catch (RuntimeException ex) {
      return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
    }
  }

  private static String formatNumber(Number number, String pattern) {
    DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
    if (number instanceof BigDecimal || number instanceof BigInteger) {
      return format.format(number);
    }
    if (number instanceof Double || number instanceof Float) {
      return format.format(number.doubleValue());
    }
    return format.format(number.longValue());
  }

  /**
   * Result of rendering a template.
   *
   * @param message rendered message; never {@code null}
   * @param properties placeholder name to original argument value; never {@code null}
   */
  public record ParseResult(String message, Map<String, Object> properties) {
    static final ParseResult EMPTY = new ParseResult("", Map.of());
  }
}
