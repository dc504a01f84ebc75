/**
 * <strong>Purpose:</strong> Immutable log event model shared by loggers and destinations.
 * <p><strong>Pipeline role:</strong> Domain layer; no I/O and no dependencies beyond the JDK.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.domain.log;
