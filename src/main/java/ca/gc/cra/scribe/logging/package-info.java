/**
 * Helpers for SCRIBE's internal SLF4J diagnostics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.logging;
