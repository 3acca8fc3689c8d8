/*
 * どこで: Send Worker サービス層
 * 何を: グローバルのスロットル期限を引き上げ、ジョブを同じ遅延で再投入する
 * なぜ: 送信先のレート制限を全ワーカーで共有し、このジョブも後で再試行するため
 */
package com.example.sendworker.service;

import com.example.common.FractionalSeconds;
import com.example.sendworker.model.SendJob;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DelaySendingNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(DelaySendingNotificationService.class);

    private final GlobalSendingThrottleStore throttleStore;
    private final SendQueue sendQueue;
    private final Clock clock;

    // どちらの書き込みが失敗しても例外をそのまま返す
    public void delayAndRequeue(SendJob job, double sendRetryDelayNumberOfSeconds) {
        Duration delay = FractionalSeconds.toDuration(sendRetryDelayNumberOfSeconds);
        Instant retryNotBefore = Instant.now(clock).plus(delay);
        throttleStore.updateRetryNotBefore(retryNotBefore);
        sendQueue.sendDelayed(job, delay);
        logger.warn("global sending delayed retryNotBefore={} notificationId={} recipientId={}",
                retryNotBefore,
                job.notificationId(),
                job.recipientId());
    }
}
