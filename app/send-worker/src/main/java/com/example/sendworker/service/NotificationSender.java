/*
 * どこで: Send Worker サービス層
 * 何を: 試行回数上限つきの通知送信の抽象化インターフェース
 * なぜ: 送信結果を成功/スロットル/失敗の 3 種に分類して返す責務を切り出すため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.SendResponse;

public interface NotificationSender {
    SendResponse send(SendParams params, int maxNumberOfAttempts);
}
