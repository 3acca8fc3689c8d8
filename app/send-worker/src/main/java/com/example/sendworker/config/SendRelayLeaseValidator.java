/*
 * どこで: Send Worker の設定検証
 * 何を: 中継の lease が送信キューの duplicate-window より短いことを起動時に検証する
 * なぜ: lease 切れ後の再 publish を Nats-Msg-Id の重複排除で 1 通にまとめられる範囲に収めるため
 */
package com.example.sendworker.config;

import org.springframework.stereotype.Component;

@Component
public class SendRelayLeaseValidator {

  public SendRelayLeaseValidator(
      SendQueueProperties queueProperties, SendRelayProperties relayProperties) {
    if (queueProperties.duplicateWindow() == null || relayProperties.lease() == null) {
      // null は各 properties 側のバリデーションで弾かれる
      return;
    }
    if (relayProperties.lease().compareTo(queueProperties.duplicateWindow()) >= 0) {
      throw new IllegalStateException(
          "send.relay.lease ("
              + relayProperties.lease()
              + ") must be shorter than send.queue.duplicate-window ("
              + queueProperties.duplicateWindow()
              + ")");
    }
  }
}
