/*
 * どこで: Send Worker サービス層
 * 何を: グローバルなスロットル期限を見て、処理を受け入れるか遅延させるかを決める
 * なぜ: システム全体がバックプレッシャー中に無駄な解決/送信を行わないため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.AdmissionDecision;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SendAdmissionGate {

  private final GlobalSendingThrottleStore throttleStore;
  private final Clock clock;

  public AdmissionDecision checkAdmission() {
    final Optional<Instant> retryNotBefore = throttleStore.findRetryNotBefore();
    final Instant now = Instant.now(clock);
    // 期限ちょうどは受け入れる
    if (retryNotBefore.isPresent() && now.isBefore(retryNotBefore.get())) {
      return AdmissionDecision.DEFER;
    }
    return AdmissionDecision.ADMIT;
  }
}
