/*
 * どこで: Send Worker サービス層
 * 何を: シリアライズ済みジョブを送信キューへ publish する抽象化インターフェース
 * なぜ: 遅延キューの中継処理をメッセージ基盤から切り離すため
 */
package com.example.sendworker.service;

public interface SendJobPublisher {

    // messageId は重複排除キー。duplicate-window 内に同じ ID で 2 回 publish しても 1 件になる
    void publish(String messageId, byte[] payload);
}
