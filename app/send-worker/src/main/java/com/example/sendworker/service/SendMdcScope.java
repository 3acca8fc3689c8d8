package com.example.sendworker.service;

import com.example.sendworker.model.DeliveryMetadata;
import com.example.sendworker.model.SendJob;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

// 1 メッセージの処理中だけ MDC に識別子を載せ、close で自分が入れたキーだけ外す
final class SendMdcScope implements AutoCloseable {

  private final List<String> keys = new ArrayList<>();

  private SendMdcScope() {}

  static SendMdcScope open(SendJob job, DeliveryMetadata metadata) {
    final SendMdcScope scope = new SendMdcScope();
    scope.put("notification_id", job.notificationId());
    scope.put("recipient_id", job.recipientId());
    scope.put("message_id", metadata.messageId());
    scope.put("delivery_count", String.valueOf(metadata.deliveryAttemptCount()));
    return scope;
  }

  private void put(String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
    keys.clear();
  }
}
