package ca.gc.cra.scribe.infrastructure.destination.sqlite;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.format.JsonLogRecordWriter;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;

/** Schema and row mapping of the {@code LogEntries} table. */
final class LogEntriesTable {
  static final String TABLE = "LogEntries";

  static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS LogEntries ("
      + "Id INTEGER PRIMARY KEY AUTOINCREMENT, "
      + "TimestampUtc TEXT NOT NULL, "
      + "LogLevel TEXT NOT NULL, "
      + "CategoryName TEXT NOT NULL, "
      + "EventId INTEGER NOT NULL, "
      + "EventName TEXT, "
      + "Message TEXT NOT NULL, "
      + "MessageTemplate TEXT, "
      + "Properties TEXT, "
      + "ScopeProperties TEXT, "
      + "Exception TEXT, "
      + "CreatedAt DATETIME DEFAULT CURRENT_TIMESTAMP)";

  static final String[] CREATE_INDEXES = {
      "CREATE INDEX IF NOT EXISTS IX_LogEntries_TimestampUtc ON LogEntries(TimestampUtc)",
      "CREATE INDEX IF NOT EXISTS IX_LogEntries_LogLevel ON LogEntries(LogLevel)",
      "CREATE INDEX IF NOT EXISTS IX_LogEntries_CategoryName ON LogEntries(CategoryName)"
  };

  private static final String INSERT = "INSERT INTO LogEntries "
      + "(TimestampUtc, LogLevel, CategoryName, EventId, EventName, Message, MessageTemplate, "
      + "Properties, ScopeProperties, Exception) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private LogEntriesTable() {
    // Utility
  }

  static void create(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate(CREATE_TABLE);
      for (String ddl : CREATE_INDEXES) {
        statement.executeUpdate(ddl);
      }
    }
  }

  static void insert(Connection connection, LogEntry entry) throws SQLException, IOException {
    try (PreparedStatement ps = connection.prepareStatement(INSERT)) {
      ps.setString(1, entry.timestamp().toString());
      ps.setString(2, entry.level().displayName());
      ps.setString(3, entry.category());
      ps.setInt(4, entry.eventId().id());
      setNullable(ps, 5, entry.eventId().name());
      ps.setString(6, entry.message());
      setNullable(ps, 7, entry.messageTemplate());
      setNullable(ps, 8, JsonLogRecordWriter.propertiesJson(entry.properties()));
      setNullable(ps, 9, JsonLogRecordWriter.propertiesJson(entry.scopeProperties()));
      setNullable(ps, 10, entry.hasException() ? entry.exception().render() : null);
      ps.executeUpdate();
    }
  }

  private static void setNullable(PreparedStatement ps, int index, String value) throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.VARCHAR);
    } else {
      ps.setString(index, value);
    }
  }
}
