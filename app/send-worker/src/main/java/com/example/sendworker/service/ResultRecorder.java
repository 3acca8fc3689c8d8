/*
 * どこで: Send Worker サービス層
 * 何を: (通知, 受信者) ごとの送信結果を記録する抽象化インターフェース
 * なぜ: 再配信で同じ組に複数回書かれても安全な記録先を差し替え可能にするため
 */
package com.example.sendworker.service;

public interface ResultRecorder {

    // 再配信で同じ組に複数回呼ばれうる。呼び出し側では重複排除しない
    // errorMessage はエラーを伴わない結果では null
    void record(String notificationId,
            String recipientId,
            int totalThrottleCount,
            boolean fromParameterResolution,
            int statusCode,
            String errorMessage);
}
