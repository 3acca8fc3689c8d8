/*
 * どこで: Send Worker サービス層
 * 何を: 送信チャネルを上限回数まで呼び出し、結果を成功/スロットル/失敗に分類する
 * なぜ: 429 は試行を使い切るまでスロットルと判定せず、それ以外の失敗は即座に確定させるため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendOutcome;
import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.SendResponse;
import com.example.sendworker.model.TransportResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetryingNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(RetryingNotificationSender.class);

    private final NotificationTransport transport;

    @Override
    public SendResponse send(SendParams params, int maxNumberOfAttempts) {
        if (maxNumberOfAttempts < 1) {
            throw new IllegalArgumentException("maxNumberOfAttempts must be at least 1");
        }
        int throttleCount = 0;
        for (int attempt = 1; attempt <= maxNumberOfAttempts; attempt++) {
            TransportResponse response = transport.deliver(params);
            if (response.isSuccess()) {
                return new SendResponse(SendOutcome.succeeded(response.statusCode()), throttleCount);
            }
            if (!response.isThrottled()) {
                return new SendResponse(
                        SendOutcome.failed(response.statusCode(), response.errorMessage()),
                        throttleCount);
            }
            throttleCount++;
            logger.debug("send attempt throttled recipientId={} attempt={} maxAttempts={}",
                    params.recipientId(),
                    attempt,
                    maxNumberOfAttempts);
        }
        // 全試行が 429 だった場合のみスロットル扱いにする
        return new SendResponse(SendOutcome.throttled(HttpStatus.TOO_MANY_REQUESTS.value()), throttleCount);
    }
}
