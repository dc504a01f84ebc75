/**
 * <strong>Purpose:</strong> Ports between the logging pipeline and its destinations, providers and metrics.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.
 * <p><strong>Concurrency:</strong> Thread-safety expectations are documented per interface.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.application.port;
