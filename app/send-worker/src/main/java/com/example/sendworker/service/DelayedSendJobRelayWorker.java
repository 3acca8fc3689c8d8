/*
 * どこで: Send Worker 遅延キュー中継ワーカー
 * 何を: スケジュールで中継処理を起動する
 * なぜ: 可視時刻を過ぎた遅延ジョブを一定間隔で送信キューへ戻すため
 */
package com.example.sendworker.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = {"send.relay.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class DelayedSendJobRelayWorker {

  private final DelayedSendJobRelayService relayService;

  @Scheduled(fixedDelayString = "${send.relay.poll-interval}")
  public void run() {
    relayService.relayDueBatch();
  }
}
