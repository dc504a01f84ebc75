package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.pipeline.AsyncScribeLogger;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.sqlite.SqliteLogDestination;
import ca.gc.cra.scribe.validation.Numbers;
import ca.gc.cra.scribe.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated, immutable description of a logging pipeline read from flat key/value settings.
 * <p><strong>Why:</strong> Separates parsing and validation of file-based configuration from pipeline assembly.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse {@code mode}, {@code minimumLevel}, {@code bufferSize}, {@code queueCapacity},
 *   {@code enqueueTimeoutMillis}, {@code metrics} and {@code otlpEndpoint}.</li>
 *   <li>Group {@code destinations.<name>.*} keys into {@link DestinationConfig} values ordered by section name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param mode sync or async delivery
 * @param minimumLevel minimum emitted level
 * @param bufferSize buffered-mode threshold shared by destinations
 * @param queueCapacity async queue capacity
 * @param enqueueTimeout async enqueue wait
 * @param metrics metrics backend
 * @param otlpEndpoint OTLP collector endpoint; may be blank
 * @param destinations destinations ordered by section name
 * @since 0.1.0
 */
public record PipelineConfig(
    Mode mode,
    LogLevel minimumLevel,
    int bufferSize,
    int queueCapacity,
    Duration enqueueTimeout,
    MetricsMode metrics,
    String otlpEndpoint,
    List<DestinationConfig> destinations) {

  private static final String DESTINATION_PREFIX = "destinations.";

  /** Delivery discipline. */
  public enum Mode {
    SYNC,
    ASYNC
  }

  /** Metrics backend. */
  public enum MetricsMode {
    NONE,
    OTLP
  }

  /** Destination kind. */
  public enum Kind {
    CONSOLE,
    PLAIN,
    JSON,
    SQLITE
  }

  public PipelineConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(minimumLevel, "minimumLevel");
    Numbers.requirePositive("bufferSize", bufferSize);
    Numbers.requirePositive("queueCapacity", queueCapacity);
    Objects.requireNonNull(enqueueTimeout, "enqueueTimeout");
    Objects.requireNonNull(metrics, "metrics");
    otlpEndpoint = otlpEndpoint == null ? "" : otlpEndpoint;
    destinations = List.copyOf(destinations);
  }

  /**
   * Parses flattened settings, as produced by {@link YamlConfigLoader}.
   *
   * @param values flat key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or a destination is incomplete
   */
  public static PipelineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Mode mode = parseEnum(Mode.class, "mode", values.getOrDefault("mode", "sync"));
    LogLevel level = LogLevel.parse(values.getOrDefault("minimumLevel", LogLevel.INFORMATION.name()));
    int bufferSize = parseInt(values, "bufferSize", DestinationOptions.DEFAULT_BUFFER_SIZE);
    int queueCapacity = parseInt(values, "queueCapacity", AsyncScribeLogger.Settings.DEFAULT_QUEUE_CAPACITY);
    long timeoutMillis = Numbers.requireRange("enqueueTimeoutMillis",
        parseInt(values, "enqueueTimeoutMillis",
            (int) AsyncScribeLogger.Settings.DEFAULT_ENQUEUE_TIMEOUT.toMillis()), 0, 60_000);
    MetricsMode metrics = parseEnum(MetricsMode.class, "metrics", values.getOrDefault("metrics", "none"));
    String endpoint = values.getOrDefault("otlpEndpoint", "");
    return new PipelineConfig(mode, level, bufferSize, queueCapacity, Duration.ofMillis(timeoutMillis), metrics,
        endpoint, parseDestinations(values));
  }

  private static List<DestinationConfig> parseDestinations(Map<String, String> values) {
    Map<String, Map<String, String>> grouped = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      String key = entry.getKey();
      if (!key.startsWith(DESTINATION_PREFIX)) {
        continue;
      }
      String rest = key.substring(DESTINATION_PREFIX.length());
      int dot = rest.indexOf('.');
      if (dot <= 0 || dot == rest.length() - 1) {
        throw new IllegalArgumentException("Malformed destination key: " + key);
      }
      grouped.computeIfAbsent(rest.substring(0, dot), name -> new LinkedHashMap<>())
          .put(rest.substring(dot + 1), entry.getValue());
    }
    List<DestinationConfig> result = new ArrayList<>(grouped.size());
    grouped.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(group -> result.add(DestinationConfig.fromMap(group.getKey(), group.getValue())));
    return result;
  }

  static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String raw) {
    String normalized = Strings.requireNonBlank(name, raw).replace('-', '_').toUpperCase(Locale.ROOT);
    for (E constant : type.getEnumConstants()) {
      if (constant.name().equals(normalized) || constant.name().replace("_", "").equals(normalized)) {
        return constant;
      }
    }
    throw new IllegalArgumentException("Unknown " + name + ": " + raw);
  }

  static int parseInt(Map<String, String> values, String key, int defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  static boolean parseBoolean(Map<String, String> values, String key, boolean defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was " + raw + ")");
    };
  }

  /**
   * One configured destination.
   *
   * @param name section name under {@code destinations}
   * @param kind destination kind
   * @param writeMode write mode; defaults to immediate for console and buffered otherwise
   * @param threadSafety thread-safety mode
   * @param path file path; blank for console
   * @param append keep existing file content
   * @param colors ANSI colors for console
   * @param poolSize SQLite connection pool size
   * @param createIfNotExists create SQLite directory and schema
   */
  public record DestinationConfig(
      String name,
      Kind kind,
      WriteMode writeMode,
      ThreadSafety threadSafety,
      String path,
      boolean append,
      boolean colors,
      int poolSize,
      boolean createIfNotExists) {

    static DestinationConfig fromMap(String name, Map<String, String> values) {
      String kindRaw = values.get("kind");
      if (kindRaw == null || kindRaw.isBlank()) {
        throw new IllegalArgumentException("destinations." + name + ".kind is required");
      }
      Kind kind = parseEnum(Kind.class, "destinations." + name + ".kind", kindRaw);
      WriteMode defaultMode = kind == Kind.CONSOLE ? WriteMode.IMMEDIATE : WriteMode.BUFFERED;
      WriteMode writeMode = values.containsKey("writeMode")
          ? parseEnum(WriteMode.class, "writeMode", values.get("writeMode"))
          : defaultMode;
      ThreadSafety threadSafety = values.containsKey("threadSafety")
          ? parseEnum(ThreadSafety.class, "threadSafety", values.get("threadSafety"))
          : ThreadSafety.THREAD_SAFE;
      String path = values.getOrDefault("path", "");
      if (kind != Kind.CONSOLE && path.isBlank()) {
        throw new IllegalArgumentException("destinations." + name + ".path is required for " + kind);
      }
      return new DestinationConfig(
          name,
          kind,
          writeMode,
          threadSafety,
          path,
          parseBoolean(values, "append", true),
          parseBoolean(values, "colors", true),
          Numbers.requirePositive("destinations." + name + ".poolSize",
              parseInt(values, "poolSize", SqliteLogDestination.DEFAULT_MAX_POOL_SIZE)),
          parseBoolean(values, "createIfNotExists", true));
    }
  }
}
