/*
 * どこで: Send Worker API
 * 何を: グローバルのスロットル期限と、現在送信を遅延させているかを返す
 * なぜ: 運用時にワーカー全体がバックプレッシャー中かどうかを確認するため
 */
package com.example.sendworker.api;

import com.example.sendworker.model.AdmissionDecision;
import com.example.sendworker.service.GlobalSendingThrottleStore;
import com.example.sendworker.service.SendAdmissionGate;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class WorkerStatusController {

  private final GlobalSendingThrottleStore throttleStore;
  private final SendAdmissionGate admissionGate;

  @GetMapping("/")
  public String home() {
    return "send-worker: ok";
  }

  @GetMapping("/status")
  public WorkerStatusResponse status() {
    return new WorkerStatusResponse(
        throttleStore.findRetryNotBefore().orElse(null),
        admissionGate.checkAdmission() == AdmissionDecision.DEFER);
  }
}
