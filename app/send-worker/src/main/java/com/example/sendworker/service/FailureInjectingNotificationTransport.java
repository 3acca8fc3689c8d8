/*
 * どこで: Send Worker サービス層
 * 何を: CI/Test 専用で 429/500 応答を注入する送信チャネル
 * なぜ: 実コード経路を汚さずに E2E で throttle -> 遅延再投入 / 失敗記録を再現するため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.TransportResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "send.transport.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationTransport implements NotificationTransport {

  private final LocalNotificationTransport delegate;

  @Value("${send.transport.failure-injection.throttled-recipient-prefix:}")
  private String throttledRecipientPrefix;

  @Value("${send.transport.failure-injection.failed-recipient-prefix:}")
  private String failedRecipientPrefix;

  @Override
  public TransportResponse deliver(SendParams params) {
    if (matches(params.recipientId(), throttledRecipientPrefix)) {
      return new TransportResponse(
          HttpStatus.TOO_MANY_REQUESTS.value(), "failure injection throttled recipient");
    }
    if (matches(params.recipientId(), failedRecipientPrefix)) {
      return new TransportResponse(
          HttpStatus.INTERNAL_SERVER_ERROR.value(),
          "failure injection matched recipientId=" + params.recipientId());
    }
    return delegate.deliver(params);
  }

  private boolean matches(String recipientId, String prefix) {
    if (prefix == null || prefix.isBlank() || recipientId == null) {
      return false;
    }
    return recipientId.startsWith(prefix);
  }
}
