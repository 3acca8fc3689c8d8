/*
 * どこで: Send Worker ドメインモデル
 * 何を: 送信に必要なパラメータ(本文/送信先)と解決フェーズの結果を保持する
 * なぜ: 解決側が処理を打ち切った(forceStop)ことと、解決中のスロットル回数を伝えるため
 */
package com.example.sendworker.model;

import com.fasterxml.jackson.databind.JsonNode;

public record SendParams(
    boolean forceStop,
    int throttleCount,
    JsonNode content,
    String serviceUrl,
    String conversationId,
    String recipientId) {

  public static SendParams forceStop(int throttleCount) {
    return new SendParams(true, throttleCount, null, null, null, null);
  }

  public static SendParams resolved(
      int throttleCount,
      JsonNode content,
      String serviceUrl,
      String conversationId,
      String recipientId) {
    return new SendParams(false, throttleCount, content, serviceUrl, conversationId, recipientId);
  }
}
