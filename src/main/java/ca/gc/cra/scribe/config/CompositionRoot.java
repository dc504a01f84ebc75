package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LoggerProvider;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that turns a {@link PipelineConfig} into a running
 * {@link LoggerProvider}.
 * <p><strong>Why:</strong> Keeps the translation from file-based settings to concrete destinations, loggers and
 * metrics in one place.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning configuration, destinations and loggers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the synchronous or asynchronous builder according to {@link PipelineConfig#mode()}.</li>
 *   <li>Create the OpenTelemetry metrics adapter when {@code metrics=otlp}.</li>
 *   <li>Close the provider before the metrics exporter so final failures are still counted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct once at startup; the provider it exposes is thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the assembled pipeline shape at INFO.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final PipelineConfig config;
  private final OpenTelemetryMetricsAdapter metricsAdapter;
  private final LoggerProvider provider;

  /**
   * Assembles the pipeline described by {@code config}.
   *
   * @param config validated pipeline configuration
   * @throws IllegalStateException if no destination is configured or a destination fails to initialize
   * @throws IllegalArgumentException if a destination path is invalid
   */
  public CompositionRoot(PipelineConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.metricsAdapter = config.metrics() == PipelineConfig.MetricsMode.OTLP
        ? OpenTelemetryMetricsAdapter.otlp(config.otlpEndpoint())
        : null;
    MetricsPort metrics = metricsAdapter == null ? MetricsPort.NO_OP : metricsAdapter;
    try {
      this.provider = config.mode() == PipelineConfig.Mode.ASYNC
          ? buildAsync(config, metrics)
          : buildSync(config, metrics);
    } catch (RuntimeException ex) {
      if (metricsAdapter != null) {
        metricsAdapter.close();
      }
      throw ex;
    }
    log.info("Logging pipeline assembled: mode={} minimumLevel={} destinations={}",
        config.mode(), config.minimumLevel(), config.destinations().size());
  }

  /**
   * Loads YAML settings for {@code profile} and assembles the pipeline.
   *
   * @param path YAML file
   * @param profile profile section to merge over {@code common}
   * @return assembled composition root
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the file is missing or its settings are invalid
   */
  public static CompositionRoot fromYaml(Path path, String profile) throws IOException {
    Map<String, String> values = YamlConfigLoader.load(path, profile)
        .orElseThrow(() -> new IllegalArgumentException("Logging configuration not found: " + path));
    return new CompositionRoot(PipelineConfig.fromMap(values));
  }

  public LoggerProvider provider() {
    return provider;
  }

  public PipelineConfig config() {
    return config;
  }

  @Override
  public void close() {
    try {
      provider.close();
    } finally {
      if (metricsAdapter != null) {
        metricsAdapter.close();
      }
    }
  }

  private static LoggerProvider buildSync(PipelineConfig config, MetricsPort metrics) {
    LoggerConfiguration builder = LoggerConfiguration.create()
        .setMinimumLevel(config.minimumLevel())
        .setBufferSize(config.bufferSize())
        .setMetrics(metrics);
    for (PipelineConfig.DestinationConfig destination : config.destinations()) {
      switch (destination.kind()) {
        case CONSOLE -> builder.addConsole(
            destination.writeMode(), destination.threadSafety(), destination.colors());
        case PLAIN -> builder.addPlainText(
            destination.path(), destination.writeMode(), destination.threadSafety(), destination.append());
        case JSON -> builder.addJson(
            destination.path(), destination.writeMode(), destination.threadSafety(), destination.append());
        case SQLITE -> builder.addSqlite(destination.path(), destination.writeMode(), destination.threadSafety(),
            destination.createIfNotExists(), destination.poolSize());
        default -> throw new IllegalArgumentException("Unsupported destination kind: " + destination.kind());
      }
    }
    return builder.build();
  }

  private static LoggerProvider buildAsync(PipelineConfig config, MetricsPort metrics) {
    AsyncLoggerConfiguration builder = AsyncLoggerConfiguration.create()
        .setMinimumLevel(config.minimumLevel())
        .setBufferSize(config.bufferSize())
        .setQueueCapacity(config.queueCapacity())
        .setEnqueueTimeout(config.enqueueTimeout())
        .setMetrics(metrics);
    for (PipelineConfig.DestinationConfig destination : config.destinations()) {
      switch (destination.kind()) {
        case CONSOLE -> builder.addConsole(
            System.out, destination.writeMode(), destination.threadSafety(), destination.colors());
        case PLAIN -> builder.addPlainText(
            destination.path(), destination.writeMode(), destination.threadSafety(), destination.append());
        case JSON -> builder.addJson(
            destination.path(), destination.writeMode(), destination.threadSafety(), destination.append());
        case SQLITE -> builder.addSqlite(destination.path(), destination.writeMode(), destination.threadSafety(),
            destination.createIfNotExists(), destination.poolSize());
        default -> throw new IllegalArgumentException("Unsupported destination kind: " + destination.kind());
      }
    }
    return builder.build();
  }
}
