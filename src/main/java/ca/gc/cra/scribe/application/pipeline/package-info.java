/**
 * <strong>Purpose:</strong> Loggers and logger factories: level filtering, entry construction and fan-out.
 * <p><strong>Pipeline role:</strong> Application layer between call sites and destinations.
 * <p><strong>Concurrency:</strong> Sync loggers deliver on the caller thread; async loggers own a bounded queue and
 * one consumer thread each.
 * <p><strong>Telemetry:</strong> Queue saturation and delivery failures are counted through the metrics port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.application.pipeline;
