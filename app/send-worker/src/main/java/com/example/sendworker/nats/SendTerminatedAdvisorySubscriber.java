/*
 * どこで: Send Worker NATS 購読
 * 何を: 送信キュー consumer の MSG_TERMINATED advisory を購読して dead-letter として記録する
 * なぜ: 復元できず TERM したメッセージもログだけで消えず、再投入対象として特定できるようにするため
 */
package com.example.sendworker.nats;

import com.example.sendworker.config.SendQueueProperties;
import com.example.sendworker.config.SendQueueTerminatedAdvisoryProperties;
import com.example.sendworker.model.DeadLetterReason;
import com.example.sendworker.service.SendDeadLetterService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Message;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class SendTerminatedAdvisorySubscriber {

    private final JetStreamAdvisoryConsumer consumer;

    public SendTerminatedAdvisorySubscriber(Connection connection,
            SendQueueProperties queueProperties,
            SendQueueTerminatedAdvisoryProperties advisoryProperties,
            SendDeadLetterService deadLetterService,
            ObjectMapper objectMapper) {
        this.consumer = new JetStreamAdvisoryConsumer(
                connection,
                new JetStreamAdvisoryConsumer.Target(
                        advisoryProperties.subject(),
                        advisoryProperties.stream(),
                        advisoryProperties.durable()),
                queueProperties.ackWait(),
                queueProperties.maxDeliver(),
                objectMapper,
                (streamSeq, deliveries) ->
                        deadLetterService.record(streamSeq, DeadLetterReason.TERMINATED, deliveries));
    }

    @PostConstruct
    public void start() {
        consumer.start();
    }

    @PreDestroy
    public void stop() {
        consumer.stop();
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        consumer.handleMessage(message);
    }
}
