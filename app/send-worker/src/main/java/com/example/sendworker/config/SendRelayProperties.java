/*
 * どこで: Send Worker の設定バインド
 * 何を: 遅延ジョブ中継の poll 間隔/バッチサイズ/lease を保持する
 * なぜ: 遅延ジョブを送信キューへ戻す速さを環境ごとに調整するため
 */
package com.example.sendworker.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "send.relay")
@Validated
public record SendRelayProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @NotNull Duration lease) {

  @AssertTrue(message = "send.relay.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "send.relay.lease must be positive")
  public boolean isLeasePositive() {
    // lease が 0 だと claim 直後に他の中継が同じ行を取り直せてしまう
    return isPositiveDuration(lease);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
