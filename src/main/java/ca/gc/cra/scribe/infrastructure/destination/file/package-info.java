/**
 * <strong>Purpose:</strong> File destinations writing plain-text or JSON-lines records.
 * <p><strong>Pipeline role:</strong> Infrastructure adapters behind the destination ports.
 * <p><strong>Concurrency:</strong> Inherited from the base destination classes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.destination.file;
