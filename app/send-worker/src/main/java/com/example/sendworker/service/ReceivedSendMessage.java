/*
 * どこで: Send Worker サービス層
 * 何を: キュー基盤に依存しない受信メッセージの抽象(ペイロード/配信メタデータ/応答操作)
 * なぜ: 中核処理を特定のメッセージキュー実装から切り離すため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.DeliveryMetadata;

public interface ReceivedSendMessage {

    byte[] payload();

    DeliveryMetadata metadata();

    // 処理完了。再配信されない
    void ack();

    // キューへ戻す。上限到達でキュー側が dead-letter にする
    void retry();

    // 処理不能なメッセージを再配信させずに捨てる
    void discard();
}
