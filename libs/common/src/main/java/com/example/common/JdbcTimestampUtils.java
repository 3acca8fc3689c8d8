/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp を相互に変換する
 * なぜ: PostgreSQL JDBC の型推論に頼らず、null を含めて明示的にバインド/読み出しするため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC を表すため Timestamp.from でそのまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // nullable 列の読み出しを RowMapper ごとに書かないための補助
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
