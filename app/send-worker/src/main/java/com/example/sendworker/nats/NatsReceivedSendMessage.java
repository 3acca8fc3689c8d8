/*
 * どこで: Send Worker NATS 購読
 * 何を: JetStream Message を ReceivedSendMessage として包む
 * なぜ: 配信回数/投入時刻/メッセージ ID を JetStream メタデータから取り出し、ack/nak/term に対応付けるため
 */
package com.example.sendworker.nats;

import com.example.sendworker.model.DeliveryMetadata;
import com.example.sendworker.service.ReceivedSendMessage;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.time.Instant;

final class NatsReceivedSendMessage implements ReceivedSendMessage {

    static final String MSG_ID_HEADER = "Nats-Msg-Id";

    private final Message message;
    private final DeliveryMetadata metadata;

    private NatsReceivedSendMessage(Message message, DeliveryMetadata metadata) {
        this.message = message;
        this.metadata = metadata;
    }

    // JetStream 以外のメッセージでは metaData() が IllegalStateException を投げる
    static NatsReceivedSendMessage from(Message message) {
        NatsJetStreamMetaData jsMetaData = message.metaData();
        Instant enqueuedAt = jsMetaData.timestamp() == null ? null : jsMetaData.timestamp().toInstant();
        DeliveryMetadata metadata = new DeliveryMetadata(
                Math.toIntExact(jsMetaData.deliveredCount()),
                enqueuedAt,
                resolveMessageId(message, jsMetaData));
        return new NatsReceivedSendMessage(message, metadata);
    }

    private static String resolveMessageId(Message message, NatsJetStreamMetaData jsMetaData) {
        Headers headers = message.getHeaders();
        if (headers != null) {
            String msgId = headers.getFirst(MSG_ID_HEADER);
            if (msgId != null && !msgId.isBlank()) {
                return msgId;
            }
        }
        // publish 側が Nats-Msg-Id を付けていなければ stream 内の連番で識別する
        return "stream-seq-" + jsMetaData.streamSequence();
    }

    @Override
    public byte[] payload() {
        return message.getData();
    }

    @Override
    public DeliveryMetadata metadata() {
        return metadata;
    }

    @Override
    public void ack() {
        message.ack();
    }

    @Override
    public void retry() {
        message.nak();
    }

    @Override
    public void discard() {
        message.term();
    }
}
