/*
 * どこで: Send Worker データアクセス
 * 何を: send_results の上書き保存/取得を担う
 * なぜ: (通知, 受信者) ごとに最新の送信結果を 1 行で保持するため
 */
package com.example.sendworker.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.sendworker.model.ResultRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SendResultRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(ResultRecord record) {
    // 再配信で同じ組が来たら上書きする(回数は積算しない)
    final String sql =
        """
        INSERT INTO send_results (
          notification_id,
          recipient_id,
          total_throttle_count,
          from_parameter_resolution,
          status_code,
          error_message,
          recorded_at
        ) VALUES (
          :notificationId,
          :recipientId,
          :totalThrottleCount,
          :fromParameterResolution,
          :statusCode,
          :errorMessage,
          :recordedAt
        )
        ON CONFLICT (notification_id, recipient_id) DO UPDATE
        SET total_throttle_count = EXCLUDED.total_throttle_count,
            from_parameter_resolution = EXCLUDED.from_parameter_resolution,
            status_code = EXCLUDED.status_code,
            error_message = EXCLUDED.error_message,
            recorded_at = EXCLUDED.recorded_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("recipientId", record.recipientId())
            .addValue("totalThrottleCount", record.totalThrottleCount())
            .addValue("fromParameterResolution", record.fromParameterResolution())
            .addValue("statusCode", record.statusCode())
            .addValue("errorMessage", record.errorMessage())
            .addValue("recordedAt", toTimestamp(record.recordedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<ResultRecord> find(String notificationId, String recipientId) {
    final String sql =
        """
        SELECT notification_id, recipient_id, total_throttle_count, from_parameter_resolution,
               status_code, error_message, recorded_at
        FROM send_results
        WHERE notification_id = :notificationId
          AND recipient_id = :recipientId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId);
    final List<ResultRecord> rows = jdbcTemplate.query(sql, params, this::mapRow);
    return rows.stream().findFirst();
  }

  private ResultRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ResultRecord(
        rs.getString("notification_id"),
        rs.getString("recipient_id"),
        rs.getInt("total_throttle_count"),
        rs.getBoolean("from_parameter_resolution"),
        rs.getInt("status_code"),
        rs.getString("error_message"),
        getInstant(rs, "recorded_at"));
  }
}
