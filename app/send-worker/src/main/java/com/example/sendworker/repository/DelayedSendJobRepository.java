/*
 * どこで: Send Worker データアクセス
 * 何を: delayed_send_jobs の登録/claim/削除/件数取得を担う
 * なぜ: 遅延再投入ジョブを複数ワーカーで重複なく中継するため
 */
package com.example.sendworker.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.sendworker.model.DelayedSendJob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DelayedSendJobRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(DelayedSendJob job) {
    final String sql =
        """
        INSERT INTO delayed_send_jobs (
          delayed_job_id,
          notification_id,
          recipient_id,
          payload_json,
          visible_at,
          locked_by,
          lease_until,
          created_at
        ) VALUES (
          :delayedJobId,
          :notificationId,
          :recipientId,
          :payloadJson::jsonb,
          :visibleAt,
          :lockedBy,
          :leaseUntil,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("delayedJobId", job.delayedJobId())
            .addValue("notificationId", job.notificationId())
            .addValue("recipientId", job.recipientId())
            .addValue("payloadJson", job.payloadJson())
            .addValue("visibleAt", toTimestamp(job.visibleAt()))
            .addValue("lockedBy", job.lockedBy())
            .addValue("leaseUntil", toTimestamp(job.leaseUntil()))
            .addValue("createdAt", toTimestamp(job.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<DelayedSendJob> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 可視時刻を過ぎ、未 claim か lease 切れの行だけを SKIP LOCKED で取る
    final String sql =
        """
        WITH cte AS (
          SELECT delayed_job_id
          FROM delayed_send_jobs
          WHERE visible_at <= :now
            AND (lease_until IS NULL OR lease_until <= :now)
          ORDER BY visible_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE delayed_send_jobs d
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        FROM cte
        WHERE d.delayed_job_id = cte.delayed_job_id
        RETURNING d.delayed_job_id, d.notification_id, d.recipient_id,
                  d.payload_json::text AS payload_json_text, d.visible_at,
                  d.locked_by, d.lease_until, d.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int delete(UUID delayedJobId, String lockedBy) {
    final String sql =
        """
        DELETE FROM delayed_send_jobs
        WHERE delayed_job_id = :delayedJobId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("delayedJobId", delayedJobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int countPending() {
    final String sql = "SELECT COUNT(*) FROM delayed_send_jobs";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private DelayedSendJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DelayedSendJob(
        UUID.fromString(rs.getString("delayed_job_id")),
        rs.getString("notification_id"),
        rs.getString("recipient_id"),
        rs.getString("payload_json_text"),
        getInstant(rs, "visible_at"),
        rs.getString("locked_by"),
        getInstant(rs, "lease_until"),
        getInstant(rs, "created_at"));
  }
}
