/*
 * どこで: Send Worker サービス層
 * 何を: 受信メッセージを SendJob に復元し、オーケストレータの判定を ack/retry/discard に変換する
 * なぜ: キュー基盤ごとの応答操作を中核処理から切り離すため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.DeliveryMetadata;
import com.example.sendworker.model.InvocationDecision;
import com.example.sendworker.model.SendJob;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SendMessageHandler {

    private static final Logger logger = LoggerFactory.getLogger(SendMessageHandler.class);

    private final SendJobCodec codec;
    private final SendOrchestrator orchestrator;
    private final SendMetrics metrics;
    private final Clock clock;

    public void handle(ReceivedSendMessage message) {
        DeliveryMetadata metadata = message.metadata();
        SendJob job;
        try {
            job = codec.decode(message.payload());
        } catch (SendJobDecodeException ex) {
            // payload 破損は再配信で回復しないため TERM する。dead-letter には TERM の advisory 経由で残る
            metrics.recordOutcome(SendMetrics.RESULT_DISCARDED);
            logger.warn("failed to decode send queue payload messageId={} deliveryCount={}",
                    metadata.messageId(),
                    metadata.deliveryAttemptCount(),
                    ex);
            discardSilently(message);
            return;
        }
        metrics.recordQueueLatency(metadata.enqueuedAt(), Instant.now(clock));

        InvocationDecision decision;
        try (SendMdcScope ignored = SendMdcScope.open(job, metadata)) {
            decision = orchestrator.process(job, metadata);
        }
        if (decision == InvocationDecision.ACK) {
            ackSilently(message);
        } else {
            retrySilently(message);
        }
    }

    private void ackSilently(ReceivedSendMessage message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            // ack 失敗時は ack-wait 経過後に再配信される
            logger.warn("failed to ack send queue message messageId={}", message.metadata().messageId(), ex);
        }
    }

    private void retrySilently(ReceivedSendMessage message) {
        try {
            message.retry();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack send queue message messageId={}", message.metadata().messageId(), ex);
        }
    }

    private void discardSilently(ReceivedSendMessage message) {
        try {
            message.discard();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term send queue message messageId={}", message.metadata().messageId(), ex);
        }
    }
}
