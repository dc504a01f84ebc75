/**
 * <strong>Purpose:</strong> Argument validation shared by builders and configuration loaders.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.validation;
