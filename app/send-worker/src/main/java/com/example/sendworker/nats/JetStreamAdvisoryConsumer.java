/*
 * どこで: Send Worker NATS 購読
 * 何を: 送信キュー consumer の advisory を durable consumer で購読し、stream_seq/deliveries を記録先へ渡す
 * なぜ: MaxDeliver と TERM の両 advisory で stream 作成・購読・ack 制御を揃えるため
 */
package com.example.sendworker.nats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

final class JetStreamAdvisoryConsumer {

    private static final Logger logger = LoggerFactory.getLogger(JetStreamAdvisoryConsumer.class);

    @FunctionalInterface
    interface AdvisoryRecorder {
        void record(long streamSeq, long deliveries);
    }

    record Target(String subject, String stream, String durable) {
    }

    private final Connection connection;
    private final Target target;
    private final Duration ackWait;
    private final int maxDeliver;
    private final ObjectMapper objectMapper;
    private final AdvisoryRecorder recorder;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    JetStreamAdvisoryConsumer(Connection connection,
            Target target,
            Duration ackWait,
            int maxDeliver,
            ObjectMapper objectMapper,
            AdvisoryRecorder recorder) {
        this.connection = connection;
        this.target = target;
        this.ackWait = ackWait;
        this.maxDeliver = maxDeliver;
        this.objectMapper = objectMapper;
        this.recorder = recorder;
    }

    void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            // advisory は保持されないため stream に取り込んでから durable で読む
            JetStreamStreams.upsert(connection.jetStreamManagement(), StreamConfiguration.builder()
                    .name(target.stream())
                    .subjects(target.subject())
                    .build());
            dispatcher = connection.createDispatcher();
            subscription = connection.jetStream().subscribe(
                    target.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    pushSubscribeOptions());
            logger.info("send advisory consumer started subject={} stream={} durable={}",
                    target.subject(),
                    target.stream(),
                    target.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream advisory subscription subject="
                    + target.subject(), ex);
        }
    }

    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    void handleMessage(Message message) {
        long streamSeq;
        long deliveries;
        try {
            JsonNode payload = objectMapper.readTree(message.getData());
            streamSeq = longField(payload, "stream_seq");
            deliveries = Math.max(longField(payload, "deliveries"), 0L);
        } catch (IOException ex) {
            // 不正 JSON は再配信しても回復しないため ack で破棄する
            logger.warn("failed to parse advisory payload subject={}", target.subject(), ex);
            ackSilently(message);
            return;
        }
        if (streamSeq <= 0L) {
            // stream_seq が取れない advisory は再処理に使えないため破棄する
            logger.warn("advisory payload missing stream_seq subject={}", target.subject());
            ackSilently(message);
            return;
        }
        try {
            recorder.record(streamSeq, deliveries);
            message.ack();
        } catch (DataAccessException ex) {
            // DB 障害は復旧後に再処理できるよう nak で再配信させる
            logger.warn("temporary failure while recording advisory subject={} streamSeq={}",
                    target.subject(),
                    streamSeq,
                    ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            logger.warn("failed to record advisory subject={} streamSeq={}", target.subject(), streamSeq, ex);
            nakSilently(message);
        }
    }

    private static long longField(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        return node == null || !node.canConvertToLong() ? 0L : node.asLong();
    }

    private PushSubscribeOptions pushSubscribeOptions() {
        return PushSubscribeOptions.builder()
                .stream(target.stream())
                .durable(target.durable())
                .configuration(ConsumerConfiguration.builder()
                        .ackPolicy(AckPolicy.Explicit)
                        .ackWait(ackWait)
                        .maxDeliver(maxDeliver)
                        .build())
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack advisory message subject={}", target.subject(), ex);
        }
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack advisory message subject={}", target.subject(), ex);
        }
    }
}
