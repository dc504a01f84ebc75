/**
 * <strong>Purpose:</strong> Base classes shared by every destination: buffering, locking and failure reporting.
 * <p><strong>Pipeline role:</strong> Infrastructure side of the destination ports.
 * <p><strong>Concurrency:</strong> Thread-safe or single-writer per {@link ca.gc.cra.scribe.domain.log.ThreadSafety}.
 * <p><strong>Telemetry:</strong> Failures are reported on the {@code ca.gc.cra.scribe.diagnostics} SLF4J logger.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.destination;
