/**
 * Text and JSON renderings of log entries shared by the concrete destinations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.destination.format;
