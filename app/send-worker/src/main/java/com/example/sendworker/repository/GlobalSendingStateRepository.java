/*
 * どこで: Send Worker データアクセス
 * 何を: global_sending_state の単一行(再送可能時刻)を読み書きする
 * なぜ: 全ワーカーで共有するスロットル期限を DB に置くため
 */
package com.example.sendworker.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.sendworker.service.GlobalSendingThrottleStore;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class GlobalSendingStateRepository implements GlobalSendingThrottleStore {

  static final String GLOBAL_STATE_KEY = "global";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<Instant> findRetryNotBefore() {
    final String sql =
        """
        SELECT send_retry_delay_time
        FROM global_sending_state
        WHERE state_key = :stateKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("stateKey", GLOBAL_STATE_KEY);
    final List<Timestamp> rows =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getTimestamp("send_retry_delay_time"));
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(toInstant(rows.get(0)));
  }

  @Override
  public void updateRetryNotBefore(Instant retryNotBefore) {
    // ロックもトランザクションも使わず最後の書き込みを採用する(読み取りとの競合は許容)
    final String sql =
        """
        INSERT INTO global_sending_state (
          state_key,
          send_retry_delay_time,
          updated_at
        ) VALUES (
          :stateKey,
          :retryNotBefore,
          now()
        )
        ON CONFLICT (state_key) DO UPDATE
        SET send_retry_delay_time = EXCLUDED.send_retry_delay_time,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("stateKey", GLOBAL_STATE_KEY)
            .addValue("retryNotBefore", toTimestamp(retryNotBefore));
    jdbcTemplate.update(sql, params);
  }
}
