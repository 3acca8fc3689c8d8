/*
 * どこで: Send Worker 遅延再投入サービスのユニットテスト
 * 何を: グローバル期限の更新と再投入が同じ遅延で行われることを検証する
 * なぜ: 書き込み失敗を握りつぶさず呼び出し元へ返すことを保証するため
 */
package com.example.sendworker.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.sendworker.model.SendJob;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DelaySendingNotificationServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private GlobalSendingThrottleStore throttleStore;

  @Mock private SendQueue sendQueue;

  private DelaySendingNotificationService service;
  private SendJob job;

  @BeforeEach
  void setUp() {
    service =
        new DelaySendingNotificationService(
            throttleStore, sendQueue, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    job = new SendJob("N1", "R1", null, null);
  }

  @Test
  void raisesGlobalDeadlineThenRequeuesWithSameDelay() {
    service.delayAndRequeue(job, 660.0d);

    final InOrder order = inOrder(throttleStore, sendQueue);
    order.verify(throttleStore).updateRetryNotBefore(FIXED_NOW.plusSeconds(660));
    order.verify(sendQueue).sendDelayed(job, Duration.ofSeconds(660));
  }

  @Test
  void fractionalDelayIsRoundedUpToMillis() {
    service.delayAndRequeue(job, 1.0005d);

    verify(throttleStore).updateRetryNotBefore(FIXED_NOW.plusMillis(1001));
    verify(sendQueue).sendDelayed(job, Duration.ofMillis(1001));
  }

  @Test
  void propagatesGlobalStateWriteFailureWithoutRequeue() {
    doThrow(new DataAccessResourceFailureException("db down"))
        .when(throttleStore)
        .updateRetryNotBefore(any());

    assertThatThrownBy(() -> service.delayAndRequeue(job, 660.0d))
        .isInstanceOf(DataAccessResourceFailureException.class);
    verifyNoInteractions(sendQueue);
  }

  @Test
  void propagatesRequeueFailure() {
    doThrow(new DataAccessResourceFailureException("insert failed"))
        .when(sendQueue)
        .sendDelayed(any(), any());

    assertThatThrownBy(() -> service.delayAndRequeue(job, 660.0d))
        .isInstanceOf(DataAccessResourceFailureException.class)
        .hasMessageContaining("insert failed");
  }

  @Test
  void rejectsNegativeDelay() {
    assertThatThrownBy(() -> service.delayAndRequeue(job, -1.0d))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(throttleStore, sendQueue);
  }
}
