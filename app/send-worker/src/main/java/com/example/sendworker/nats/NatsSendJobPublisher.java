/*
 * どこで: Send Worker NATS publish
 * 何を: 遅延キューから戻すジョブを Nats-Msg-Id 付きで送信キューへ publish する
 * なぜ: JetStream の duplicate-window で同じ遅延ジョブの二重投入を防ぐため
 */
package com.example.sendworker.nats;

import com.example.sendworker.config.SendQueueProperties;
import com.example.sendworker.service.SendJobPublisher;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsSendJobPublisher implements SendJobPublisher {

    private static final Logger logger = LoggerFactory.getLogger(NatsSendJobPublisher.class);

    private final Connection connection;
    private final SendQueueProperties properties;

    @Override
    public void publish(String messageId, byte[] payload) {
        final Headers headers = new Headers();
        // 重複排除キーとして遅延ジョブ ID を NATS の標準ヘッダに載せる
        headers.add(NatsReceivedSendMessage.MSG_ID_HEADER, messageId);
        final PublishAck ack;
        try {
            ack = connection.jetStream().publish(properties.subject(), headers, payload);
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to publish send job messageId=" + messageId, ex);
        }
        // puback を受け取れた場合のみ publish 成功とみなす
        if (ack == null) {
            throw new IllegalStateException("puback is missing messageId=" + messageId);
        }
        if (ack.isDuplicate()) {
            logger.info("send job publish deduplicated messageId={} streamSeq={}", messageId, ack.getSeqno());
        }
    }
}
