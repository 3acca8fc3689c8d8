/*
 * どこで: Send Worker ドメインモデル
 * 何を: 1 回の送信の分類結果(成功/スロットル/失敗)とステータスコードを表す
 * なぜ: オーケストレータの分岐だけに使い、永続化はしないため
 */
package com.example.sendworker.model;

public record SendOutcome(SendOutcomeType type, int statusCode, String errorMessage) {

  public SendOutcome {
    if (type == null) {
      throw new IllegalArgumentException("type must not be null");
    }
    if (type != SendOutcomeType.FAILED && errorMessage != null) {
      throw new IllegalArgumentException("errorMessage is only carried by FAILED outcomes");
    }
  }

  public static SendOutcome succeeded(int statusCode) {
    return new SendOutcome(SendOutcomeType.SUCCEEDED, statusCode, null);
  }

  public static SendOutcome throttled(int statusCode) {
    return new SendOutcome(SendOutcomeType.THROTTLED, statusCode, null);
  }

  public static SendOutcome failed(int statusCode, String errorMessage) {
    return new SendOutcome(SendOutcomeType.FAILED, statusCode, errorMessage);
  }
}
