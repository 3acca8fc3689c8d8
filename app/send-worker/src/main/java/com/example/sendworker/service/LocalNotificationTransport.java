/*
 * どこで: Send Worker サービス層
 * 何を: 通知送信を模擬するチャネル実装
 * なぜ: 外部チャネル無しでキュー処理と結果記録の流れを確認するため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

@Component
public class LocalNotificationTransport implements NotificationTransport {

    private static final Logger logger = LoggerFactory.getLogger(LocalNotificationTransport.class);

    @Override
    public TransportResponse deliver(SendParams params) {
        // 実送信は行わず、ログに残すだけとする
        logger.info("notification simulated send recipientId={} conversationId={} serviceUrl={}",
                params.recipientId(),
                params.conversationId(),
                params.serviceUrl());
        return TransportResponse.of(HttpStatus.CREATED.value());
    }
}
