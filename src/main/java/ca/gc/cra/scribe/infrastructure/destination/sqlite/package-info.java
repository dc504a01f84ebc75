/**
 * Embedded SQLite destinations persisting entries to the {@code LogEntries} table.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.destination.sqlite;
