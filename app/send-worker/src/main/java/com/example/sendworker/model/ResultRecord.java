/*
 * どこで: Send Worker ドメインモデル
 * 何を: send_results テーブルの 1 行((通知, 受信者) ごとの最新結果)
 * なぜ: 再配信で同じ組に複数回書かれても 1 行として扱うため
 */
package com.example.sendworker.model;

import java.time.Instant;

public record ResultRecord(
        String notificationId,
        String recipientId,
        int totalThrottleCount,
        boolean fromParameterResolution,
        int statusCode,
        String errorMessage,
        Instant recordedAt) {
}
