/*
 * どこで: Send Worker の設定バインド
 * 何を: 送信キュー(JetStream)の subject/stream/durable/duplicate-window/ack-wait/max-deliver を保持する
 * なぜ: 再配信の猶予と上限を環境ごとに調整しつつ、起動時に妥当性を検証するため
 */
package com.example.sendworker.config;

import com.example.sendworker.service.SendOrchestrator;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "send.queue")
@Validated
public record SendQueueProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "send.queue.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "send.queue.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // ack-wait はホストの処理期限を兼ねるため 0 以下は許容しない
    return isPositiveDuration(ackWait);
  }

  @AssertTrue(message = "send.queue.max-deliver must not be below the dead-letter delivery count")
  public boolean isMaxDeliverCoveringDeadLetterCount() {
    // 最終配信の判定回数がキュー側の上限を超えると terminal の記録が残らなくなる
    return maxDeliver == null
        || maxDeliver >= SendOrchestrator.MAX_DELIVERY_COUNT_FOR_DEAD_LETTER;
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
