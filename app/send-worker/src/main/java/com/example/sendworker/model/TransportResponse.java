package com.example.sendworker.model;

// 送信チャネルへの 1 回の呼び出し結果
public record TransportResponse(int statusCode, String errorMessage) {

  private static final int SUCCESS_MIN = 200;
  private static final int SUCCESS_MAX = 299;
  private static final int TOO_MANY_REQUESTS = 429;

  public static TransportResponse of(int statusCode) {
    return new TransportResponse(statusCode, null);
  }

  public boolean isSuccess() {
    return statusCode >= SUCCESS_MIN && statusCode <= SUCCESS_MAX;
  }

  public boolean isThrottled() {
    return statusCode == TOO_MANY_REQUESTS;
  }
}
