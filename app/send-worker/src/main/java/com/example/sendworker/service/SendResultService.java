/*
 * どこで: Send Worker サービス層
 * 何を: 送信結果を send_results へ上書き保存する
 * なぜ: 再配信ごとに最新の結果だけを残し、記録回数に依存しない集計を可能にするため
 */
package com.example.sendworker.service;

import com.example.sendworker.config.SendFunctionProperties;
import com.example.sendworker.model.ResultRecord;
import com.example.sendworker.repository.SendResultRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendResultService implements ResultRecorder {

  private static final Logger logger = LoggerFactory.getLogger(SendResultService.class);

  private final SendResultRepository sendResultRepository;
  private final SendFunctionProperties properties;
  private final Clock clock;

  @Override
  public void record(
      String notificationId,
      String recipientId,
      int totalThrottleCount,
      boolean fromParameterResolution,
      int statusCode,
      String errorMessage) {
    final ResultRecord record =
        new ResultRecord(
            notificationId,
            recipientId,
            totalThrottleCount,
            fromParameterResolution,
            statusCode,
            truncateError(errorMessage),
            Instant.now(clock));
    sendResultRepository.upsert(record);
    logger.debug(
        "send result recorded notificationId={} recipientId={} statusCode={} throttles={}",
        notificationId,
        recipientId,
        statusCode,
        totalThrottleCount);
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
