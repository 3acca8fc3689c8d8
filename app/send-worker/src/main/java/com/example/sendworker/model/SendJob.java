/*
 * どこで: Send Worker ドメインモデル
 * 何を: 送信キューの 1 メッセージ(通知 ID/受信者 ID/受信者データ/解決済み送信パラメータ)を表す
 * なぜ: 再配信や遅延再投入でも同じ内容を運べる不変値として扱うため
 */
package com.example.sendworker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendJob(
    String notificationId, String recipientId, JsonNode recipientData, JsonNode resolvedParams) {

  public SendJob {
    if (notificationId == null || notificationId.isBlank()) {
      throw new IllegalArgumentException("notificationId must not be blank");
    }
    if (recipientId == null || recipientId.isBlank()) {
      throw new IllegalArgumentException("recipientId must not be blank");
    }
    // JsonNode は可変なので取り込み時に複製する
    recipientData =
        recipientData == null || recipientData.isNull()
            ? JsonNodeFactory.instance.objectNode()
            : recipientData.deepCopy();
    resolvedParams =
        resolvedParams == null || resolvedParams.isNull() || resolvedParams.isMissingNode()
            ? null
            : resolvedParams.deepCopy();
  }

  @Override
  public JsonNode recipientData() {
    return recipientData.deepCopy();
  }

  @Override
  public JsonNode resolvedParams() {
    return resolvedParams == null ? null : resolvedParams.deepCopy();
  }

  public boolean hasResolvedParams() {
    return resolvedParams != null;
  }
}
