/**
 * OpenTelemetry implementation of the metrics port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.metrics;
