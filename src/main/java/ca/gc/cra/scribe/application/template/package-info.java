/**
 * <strong>Purpose:</strong> Message-template rendering and property extraction.
 * <p><strong>Pipeline role:</strong> Application layer helper used by loggers before entries are built.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.application.template;
