/*
 * Where: shared utilities
 * What: converts Instant to and from JDBC Timestamp explicitly
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.tokendraw.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them UTC regardless of the database time zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant readInstant(ResultSet rs, String column) throws SQLException {
    final Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }
}
