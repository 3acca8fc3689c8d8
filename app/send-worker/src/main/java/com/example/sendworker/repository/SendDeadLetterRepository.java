/*
 * どこで: Send Worker データアクセス
 * 何を: 再配信上限に達した、または TERM された送信キューメッセージの stream_seq を保存する
 * なぜ: dead-letter になったメッセージを後から特定・再投入できるようにするため
 */
package com.example.sendworker.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.sendworker.model.DeadLetterReason;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SendDeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // advisory も再配信されうるため同じ stream_seq は 1 行にする
  public boolean insertIfAbsent(
      long streamSeq, DeadLetterReason reason, long deliveries, Instant createdAt) {
    final String sql =
        """
        INSERT INTO send_dead_letters (
          stream_seq,
          reason,
          deliveries,
          created_at
        ) VALUES (
          :streamSeq,
          :reason,
          :deliveries,
          :createdAt
        )
        ON CONFLICT (stream_seq) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("streamSeq", streamSeq)
            .addValue("reason", reason.code())
            .addValue("deliveries", deliveries)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM send_dead_letters", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int countByReason(DeadLetterReason reason) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM send_dead_letters WHERE reason = :reason",
            new MapSqlParameterSource("reason", reason.code()),
            Integer.class);
    return count == null ? 0 : count;
  }
}
