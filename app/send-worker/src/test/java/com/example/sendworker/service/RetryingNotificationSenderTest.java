/*
 * どこで: Send Worker 送信のユニットテスト
 * 何を: 2xx/429/その他の応答が成功/スロットル/失敗に分類されることを検証する
 * なぜ: 429 だけが再試行対象で、他の失敗は即座に確定することを保証するため
 */
package com.example.sendworker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.sendworker.model.SendOutcomeType;
import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.SendResponse;
import com.example.sendworker.model.TransportResponse;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetryingNotificationSenderTest {

  private static final int MAX_ATTEMPTS = 3;

  @Mock private NotificationTransport transport;

  private RetryingNotificationSender sender;
  private SendParams params;

  @BeforeEach
  void setUp() {
    sender = new RetryingNotificationSender(transport);
    params =
        SendParams.resolved(
            0, JsonNodeFactory.instance.objectNode(), "https://channel.example.com", "conv-1", "R1");
  }

  @Test
  void succeedsOnFirstAttempt() {
    when(transport.deliver(params)).thenReturn(TransportResponse.of(201));

    final SendResponse response = sender.send(params, MAX_ATTEMPTS);

    assertThat(response.outcome().type()).isEqualTo(SendOutcomeType.SUCCEEDED);
    assertThat(response.outcome().statusCode()).isEqualTo(201);
    assertThat(response.throttleCount()).isZero();
  }

  @Test
  void retriesThrottleAndCountsEachRateLimitResponse() {
    when(transport.deliver(params))
        .thenReturn(TransportResponse.of(429), TransportResponse.of(429), TransportResponse.of(200));

    final SendResponse response = sender.send(params, MAX_ATTEMPTS);

    assertThat(response.outcome().type()).isEqualTo(SendOutcomeType.SUCCEEDED);
    assertThat(response.throttleCount()).isEqualTo(2);
    verify(transport, times(3)).deliver(params);
  }

  @Test
  void throttledAfterExhaustingAttempts() {
    when(transport.deliver(params)).thenReturn(TransportResponse.of(429));

    final SendResponse response = sender.send(params, MAX_ATTEMPTS);

    assertThat(response.outcome().type()).isEqualTo(SendOutcomeType.THROTTLED);
    assertThat(response.outcome().statusCode()).isEqualTo(429);
    assertThat(response.outcome().errorMessage()).isNull();
    assertThat(response.throttleCount()).isEqualTo(MAX_ATTEMPTS);
    verify(transport, times(MAX_ATTEMPTS)).deliver(params);
  }

  @Test
  void failsImmediatelyOnNonThrottleError() {
    when(transport.deliver(params))
        .thenReturn(TransportResponse.of(429), new TransportResponse(403, "bot blocked"));

    final SendResponse response = sender.send(params, MAX_ATTEMPTS);

    assertThat(response.outcome().type()).isEqualTo(SendOutcomeType.FAILED);
    assertThat(response.outcome().statusCode()).isEqualTo(403);
    assertThat(response.outcome().errorMessage()).isEqualTo("bot blocked");
    assertThat(response.throttleCount()).isEqualTo(1);
    verify(transport, times(2)).deliver(params);
  }

  @Test
  void transportExceptionPropagates() {
    when(transport.deliver(params)).thenThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> sender.send(params, MAX_ATTEMPTS))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("connection reset");
  }

  @Test
  void rejectsNonPositiveAttempts() {
    assertThatThrownBy(() -> sender.send(params, 0)).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(transport);
  }
}
