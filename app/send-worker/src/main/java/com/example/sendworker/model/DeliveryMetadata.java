/*
 * どこで: Send Worker ドメインモデル
 * 何を: キューが 1 回の配信ごとに与える事実(配信回数/投入時刻/メッセージ ID)を保持する
 * なぜ: SendJob 本体と分け、配信回数に応じた障害の重み付けに使うため
 */
package com.example.sendworker.model;

import java.time.Instant;

public record DeliveryMetadata(int deliveryAttemptCount, Instant enqueuedAt, String messageId) {

  public DeliveryMetadata {
    if (deliveryAttemptCount < 1) {
      throw new IllegalArgumentException("deliveryAttemptCount must be at least 1");
    }
  }
}
