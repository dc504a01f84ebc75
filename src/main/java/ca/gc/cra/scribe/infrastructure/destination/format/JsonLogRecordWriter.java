package ca.gc.cra.scribe.infrastructure.destination.format;

import ca.gc.cra.scribe.domain.log.ExceptionInfo;
import ca.gc.cra.scribe.domain.log.LogEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * <strong>What:</strong> Serializes log entries and property maps with Jackson's streaming generator.
 * <p><strong>Why:</strong> JSON-lines files and the SQLite property columns need compact, stable JSON without a
 * data-binding layer.</p>
 * <p><strong>Role:</strong> Infrastructure formatter shared by JSON and SQLite destinations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit {@code @timestamp}, {@code @level}, {@code @category}, {@code @message}, {@code @messageTemplate},
 *   {@code eventId}, {@code @<property>}, {@code scope.<property>} and {@code exception} fields.</li>
 *   <li>Render arbitrary property values by type, falling back to {@code toString()}.</li>
 *   <li>Rename a message property whose key would collide with a field already written to {@code @prop.<name>},
 *   numbering it while that is also taken.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 * <p><strong>Performance:</strong> One generator per record; nested values are bounded by {@link #MAX_DEPTH}.</p>
 * <p><strong>Observability:</strong> Output field names are the contract consumed by log shippers and greps.</p>
 *
 * @since 0.1.0
 */
public final class JsonLogRecordWriter {
  static final int MAX_DEPTH = 8;

  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonLogRecordWriter() {
    // Utility
  }

  /**
   * Serializes one entry as a single-line JSON object.
   *
   * @param entry entry to serialize
   * @return compact JSON without a trailing newline
   * @throws IOException if the generator fails
   */
  public static String toJsonLine(LogEntry entry) throws IOException {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      Set<String> written = new HashSet<>();
      gen.writeStartObject();
      field(gen, written, "@timestamp", entry.timestamp().toString());
      field(gen, written, "@level", entry.level().displayName());
      field(gen, written, "@category", entry.category());
      field(gen, written, "@message", entry.message());
      field(gen, written, "@messageTemplate", entry.messageTemplate());
      written.add("eventId");
      gen.writeObjectFieldStart("eventId");
      gen.writeNumberField("id", entry.eventId().id());
      gen.writeStringField("name", entry.eventId().name());
      gen.writeEndObject();
      written.add("exception");
      for (Map.Entry<String, Object> property : entry.properties().entrySet()) {
        String key = property.getKey().startsWith("@") ? property.getKey() : "@" + property.getKey();
        if (!written.add(key)) {
          key = renamedKey(written, property.getKey());
        }
        gen.writeFieldName(key);
        writeValue(gen, property.getValue(), 0);
      }
      for (Map.Entry<String, Object> property : entry.scopeProperties().entrySet()) {
        String key = "scope." + property.getKey();
        if (written.add(key)) {
          gen.writeFieldName(key);
          writeValue(gen, property.getValue(), 0);
        }
      }
      if (entry.hasException()) {
        gen.writeFieldName("exception");
        writeException(gen, entry.exception());
      }
      gen.writeEndObject();
    }
    return out.toString();
  }

  private static String renamedKey(Set<String> written, String name) {
    String base = "@prop." + name;
    String key = base;
    for (int suffix = 2; !written.add(key); suffix++) {
      key = base + "_" + suffix;
    }
    return key;
  }

  /**
   * Serializes a property map as a JSON object.
   *
   * @param properties properties to serialize
   * @return JSON text, or {@code null} when the map is empty
   * @throws IOException if the generator fails
   */
  public static String propertiesJson(Map<String, Object> properties) throws IOException {
    if (properties == null || properties.isEmpty()) {
      return null;
    }
    StringWriter out = new StringWriter(128);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      writeValue(gen, properties, 0);
    }
    return out.toString();
  }

  private static void field(JsonGenerator gen, Set<String> written, String name, String value) throws IOException {
    written.add(name);
    gen.writeStringField(name, value);
  }

  private static void writeException(JsonGenerator gen, ExceptionInfo info) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("type", info.type());
    gen.writeStringField("message", info.message());
    gen.writeStringField("stackTrace", info.stackTrace());
    gen.writeFieldName("innerException");
    if (info.cause() == null) {
      gen.writeNull();
    } else {
      writeException(gen, info.cause());
    }
    gen.writeEndObject();
  }

  static void writeValue(JsonGenerator gen, Object value, int depth) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (depth >= MAX_DEPTH) {
      gen.writeString(String.valueOf(value));
    } else if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
      gen.writeString(value.toString());
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Number number) {
      writeNumber(gen, number);
    } else if (value instanceof Enum<?> constant) {
      gen.writeString(constant.name());
    } else if (value instanceof TemporalAccessor) {
      gen.writeString(value.toString());
    } else if (value instanceof Optional<?> optional) {
      writeValue(gen, optional.orElse(null), depth);
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> item : map.entrySet()) {
        gen.writeFieldName(String.valueOf(item.getKey()));
        writeValue(gen, item.getValue(), depth + 1);
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> iterable) {
      gen.writeStartArray();
      for (Object item : iterable) {
        writeValue(gen, item, depth + 1);
      }
      gen.writeEndArray();
    } else if (value.getClass().isArray()) {
      gen.writeStartArray();
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        writeValue(gen, Array.get(value, i), depth + 1);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }

  private static void writeNumber(JsonGenerator gen, Number number) throws IOException {
    if (number instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (number instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isFinite(d)) {
        gen.writeNumber(d);
      } else {
        gen.writeString(Double.toString(d));
      }
    } else if (number instanceof Long || number instanceof Integer
        || number instanceof Short || number instanceof Byte) {
      gen.writeNumber(number.longValue());
    } else {
      gen.writeString(number.toString());
    }
  }
}
