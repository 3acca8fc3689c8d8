/*
 * どこで: Send Worker ドメインモデル
 * 何を: delayed_send_jobs テーブルのスナップショット
 * なぜ: 遅延再投入と中継(claim/publish/delete)で共通化するため
 */
package com.example.sendworker.model;

import java.time.Instant;
import java.util.UUID;

public record DelayedSendJob(
    UUID delayedJobId,
    String notificationId,
    String recipientId,
    String payloadJson,
    Instant visibleAt,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt) {}
