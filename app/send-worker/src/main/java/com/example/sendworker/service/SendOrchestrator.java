/*
 * どこで: Send Worker サービス層(中核)
 * 何を: 1 メッセージを 受け入れ判定 -> パラメータ解決 -> 送信 -> 結果分岐 の順に処理する
 * なぜ: グローバルスロットル/キューの再配信/結果記録の 3 つを互いに壊さずに協調させるため
 *
 * 1 回の呼び出しで起きるのは「何もしない」「再投入」「結果記録」「結果記録 + RETRY_OR_DEAD_LETTER」の
 * いずれか 1 つ。同じ結果に対して再投入と記録が両方起きることはない。
 */
package com.example.sendworker.service;

import com.example.sendworker.config.SendFunctionProperties;
import com.example.sendworker.model.AdmissionDecision;
import com.example.sendworker.model.DeliveryMetadata;
import com.example.sendworker.model.InvocationDecision;
import com.example.sendworker.model.SendJob;
import com.example.sendworker.model.SendOutcome;
import com.example.sendworker.model.SendParams;
import com.example.sendworker.model.SendResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendOrchestrator {

    // この配信回数以降の障害は terminal として記録する。consumer の max-deliver 以下であること
    public static final int MAX_DELIVERY_COUNT_FOR_DEAD_LETTER = 10;

    private static final Logger logger = LoggerFactory.getLogger(SendOrchestrator.class);

    private final SendAdmissionGate admissionGate;
    private final SendQueue sendQueue;
    private final SendParamsResolver paramsResolver;
    private final NotificationSender sender;
    private final DelaySendingNotificationService delaySendingService;
    private final ResultRecorder resultRecorder;
    private final SendFunctionProperties properties;
    private final SendMetrics metrics;

    public InvocationDecision process(SendJob job, DeliveryMetadata metadata) {
        int totalThrottleCount = 0;
        try {
            if (admissionGate.checkAdmission() == AdmissionDecision.DEFER) {
                // システム全体が遅延中: 解決も送信もせず同じジョブを遅延で戻す
                sendQueue.sendDelayed(job, properties.sendRetryDelay());
                metrics.recordOutcome(SendMetrics.RESULT_DEFERRED);
                logger.info("send deferred by global throttle notificationId={} recipientId={}",
                        job.notificationId(),
                        job.recipientId());
                return InvocationDecision.ACK;
            }

            SendParams params = paramsResolver.resolve(job);
            if (params.forceStop()) {
                // 解決側で記録/再投入済み
                metrics.recordOutcome(SendMetrics.RESULT_FORCE_STOPPED);
                return InvocationDecision.ACK;
            }
            totalThrottleCount += params.throttleCount();

            SendResponse response = sender.send(params, properties.maxNumberOfAttempts());
            totalThrottleCount += response.throttleCount();
            metrics.recordThrottleResponses(totalThrottleCount);

            SendOutcome outcome = response.outcome();
            switch (outcome.type()) {
                case SUCCEEDED -> {
                    logger.info("send succeeded notificationId={} recipientId={} statusCode={} throttles={}",
                            job.notificationId(),
                            params.recipientId(),
                            outcome.statusCode(),
                            totalThrottleCount);
                    resultRecorder.record(
                            job.notificationId(),
                            params.recipientId(),
                            totalThrottleCount,
                            false,
                            outcome.statusCode(),
                            null);
                    metrics.recordOutcome(SendMetrics.RESULT_SUCCEEDED);
                }
                case THROTTLED -> {
                    // 結果は記録しない: 全体の期限を引き上げ、このジョブは後で再試行する
                    logger.warn("send throttled notificationId={} recipientId={} throttles={}",
                            job.notificationId(),
                            params.recipientId(),
                            totalThrottleCount);
                    delaySendingService.delayAndRequeue(job, properties.sendRetryDelayNumberOfSeconds());
                    metrics.recordOutcome(SendMetrics.RESULT_THROTTLED);
                }
                case FAILED -> {
                    // 恒久的な失敗: 記録して再試行しない
                    logger.error("send failed notificationId={} recipientId={} statusCode={} error={}",
                            job.notificationId(),
                            params.recipientId(),
                            outcome.statusCode(),
                            outcome.errorMessage());
                    resultRecorder.record(
                            job.notificationId(),
                            params.recipientId(),
                            totalThrottleCount,
                            false,
                            outcome.statusCode(),
                            outcome.errorMessage());
                    metrics.recordOutcome(SendMetrics.RESULT_FAILED);
                }
                default -> throw new IllegalStateException("unknown send outcome " + outcome.type());
            }
            return InvocationDecision.ACK;
        } catch (RuntimeException ex) {
            return handleFault(job, metadata, totalThrottleCount, ex);
        }
    }

    private InvocationDecision handleFault(SendJob job,
            DeliveryMetadata metadata,
            int totalThrottleCount,
            RuntimeException fault) {
        boolean lastDelivery = metadata.deliveryAttemptCount() >= MAX_DELIVERY_COUNT_FOR_DEAD_LETTER;
        HttpStatus statusToStore = lastDelivery ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.CONTINUE;
        logger.error("send invocation fault notificationId={} recipientId={} deliveryCount={} lastDelivery={}",
                job.notificationId(),
                job.recipientId(),
                metadata.deliveryAttemptCount(),
                lastDelivery,
                fault);
        try {
            // 解決が終わっていない可能性があるため受信者 ID はペイロードのものを使う
            resultRecorder.record(
                    job.notificationId(),
                    job.recipientId(),
                    totalThrottleCount,
                    false,
                    statusToStore.value(),
                    describe(fault));
        } catch (RuntimeException recordFailure) {
            // 記録は診断用の best-effort。判定は変えずキューに再配信/dead-letter を任せる
            fault.addSuppressed(recordFailure);
            logger.error("failed to record send fault notificationId={} recipientId={}",
                    job.notificationId(),
                    job.recipientId(),
                    recordFailure);
        }
        metrics.recordOutcome(lastDelivery ? SendMetrics.RESULT_FAULT_TERMINAL : SendMetrics.RESULT_FAULT_CONTINUE);
        return InvocationDecision.RETRY_OR_DEAD_LETTER;
    }

    private String describe(RuntimeException fault) {
        String message = fault.getMessage();
        return message == null || message.isBlank() ? fault.getClass().getName() : message;
    }
}
