/**
 * Console destinations writing formatted lines to a print stream.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.destination.console;
