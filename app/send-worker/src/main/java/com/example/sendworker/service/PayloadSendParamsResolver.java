/*
 * どこで: Send Worker サービス層
 * 何を: キューのペイロードだけから送信パラメータを組み立てる
 * なぜ: 会話作成を伴わない送信先(会話 ID 既知)をそのまま送るため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendJob;
import com.example.sendworker.model.SendParams;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PayloadSendParamsResolver implements SendParamsResolver {

    private static final Logger logger = LoggerFactory.getLogger(PayloadSendParamsResolver.class);
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_SERVICE_URL = "serviceUrl";
    private static final String FIELD_CONVERSATION_ID = "conversationId";
    private static final String FIELD_NOTIFICATION_ID = "notificationId";
    static final String MISSING_CONVERSATION_MESSAGE = "recipient has no conversation id";

    private final ResultRecorder resultRecorder;

    @Override
    public SendParams resolve(SendJob job) {
        // 解決済みパラメータがあれば受信者データより優先する
        JsonNode source = job.hasResolvedParams() ? job.resolvedParams() : job.recipientData();
        String conversationId = text(source, FIELD_CONVERSATION_ID);
        if (conversationId == null) {
            // 会話 ID が無い受信者には送れないため、解決フェーズの結果として記録して打ち切る
            logger.warn("send params unresolved notificationId={} recipientId={} reason=missing-conversation",
                    job.notificationId(),
                    job.recipientId());
            resultRecorder.record(
                    job.notificationId(),
                    job.recipientId(),
                    0,
                    true,
                    HttpStatus.NOT_FOUND.value(),
                    MISSING_CONVERSATION_MESSAGE);
            return SendParams.forceStop(0);
        }
        return SendParams.resolved(
                0,
                resolveContent(job, source),
                text(source, FIELD_SERVICE_URL),
                conversationId,
                job.recipientId());
    }

    private JsonNode resolveContent(SendJob job, JsonNode source) {
        JsonNode content = source.get(FIELD_CONTENT);
        if (content != null && !content.isNull()) {
            return content;
        }
        // 本文が同梱されていない場合は通知 ID だけを渡し、本文の取得は送信チャネル側に任せる
        ObjectNode reference = JsonNodeFactory.instance.objectNode();
        reference.put(FIELD_NOTIFICATION_ID, job.notificationId());
        return reference;
    }

    private String text(JsonNode source, String field) {
        JsonNode node = source.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
