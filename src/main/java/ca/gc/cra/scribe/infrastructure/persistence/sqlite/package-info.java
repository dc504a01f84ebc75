/**
 * <strong>Purpose:</strong> JDBC connection pooling for the embedded database destinations.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.scribe.infrastructure.persistence.sqlite.JdbcConnectionPool} is
 * safe for concurrent use; handles are owned by one thread at a time.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.persistence.sqlite;
