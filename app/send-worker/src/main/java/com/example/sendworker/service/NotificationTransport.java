/*
 * どこで: Send Worker サービス層
 * 何を: 送信チャネルへの 1 回分の呼び出しを抽象化する
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.TransportResponse;

public interface NotificationTransport {
    TransportResponse deliver(SendParams params);
}
