/*
 * どこで: Send Worker NATS 購読
 * 何を: 送信キュー(JetStream)を購読し、受信メッセージをハンドラへ渡す
 * なぜ: durable + explicit ack の consumer で再配信と dead-letter をキュー側に任せるため
 */
package com.example.sendworker.nats;

import com.example.sendworker.config.SendQueueProperties;
import com.example.sendworker.service.SendMessageHandler;
import com.google.common.annotations.VisibleForTesting;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class SendQueueSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(SendQueueSubscriber.class);

    private final Connection connection;
    private final SendMessageHandler messageHandler;
    private final SendQueueProperties properties;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public SendQueueSubscriber(Connection connection,
            SendMessageHandler messageHandler,
            SendQueueProperties properties) {
        this.connection = connection;
        this.messageHandler = messageHandler;
        this.properties = properties;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("send queue subscriber started subject={} stream={} durable={} maxDeliver={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable(),
                    properties.maxDeliver());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start send queue subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        NatsReceivedSendMessage received;
        try {
            received = NatsReceivedSendMessage.from(message);
        } catch (IllegalStateException | IllegalArgumentException | ArithmeticException ex) {
            // JetStream メタデータが無いメッセージは ack/nak できないため読み捨てる
            logger.warn("send queue message without usable JetStream metadata subject={}", message.getSubject(), ex);
            return;
        }
        try {
            messageHandler.handle(received);
        } catch (RuntimeException ex) {
            // 想定外の例外はデータロス回避のため再配信に倒す
            logger.warn("failed to handle send queue message messageId={}", received.metadata().messageId(), ex);
            nakSilently(message);
        }
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // Nats-Msg-Id による重複排除(遅延キュー中継の再 publish 対策)のため duplicate-window を固定する
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamStreams.upsert(connection.jetStreamManagement(), streamConfiguration);
        logger.info("send queue stream ensured stream={} subject={} duplicateWindow={}",
                properties.stream(),
                properties.subject(),
                properties.duplicateWindow());
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                // ack-wait は処理期限、max-deliver は dead-letter までの配信上限
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack send queue message", ex);
        }
    }
}
