/*
 * どこで: Send Worker サービス層
 * 何を: 可視時刻を過ぎた遅延ジョブを claim して送信キューへ戻す
 * なぜ: 遅延再投入したジョブを新しいメッセージとして再処理させるため
 */
package com.example.sendworker.service;

import com.example.sendworker.config.SendRelayProperties;
import com.example.sendworker.model.DelayedSendJob;
import com.example.sendworker.repository.DelayedSendJobRepository;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class DelayedSendJobRelayService {

    private static final Logger logger = LoggerFactory.getLogger(DelayedSendJobRelayService.class);
    private static final String HOSTNAME_ENV = "HOSTNAME";
    private static final String DEFAULT_HOSTNAME = "unknown-host";

    private final DelayedSendJobRepository delayedSendJobRepository;
    private final SendJobPublisher publisher;
    private final SendRelayProperties properties;
    private final SendMetrics metrics;
    private final Clock clock;

    public int relayDueBatch() {
        Instant now = Instant.now(clock);
        String lockedBy = resolveLockedBy();
        Instant leaseUntil = now.plus(properties.lease());
        // claim を単一 SQL で行い、publish の IO を長期トランザクションに載せない
        List<DelayedSendJob> due = delayedSendJobRepository.claimDue(
                properties.batchSize(),
                now,
                leaseUntil,
                lockedBy);
        int relayed = 0;
        for (DelayedSendJob job : due) {
            try {
                // 遅延ジョブ ID を重複排除キーにし、lease 切れ後の再 publish を 1 通にまとめる
                publisher.publish(job.delayedJobId().toString(), job.payloadJson().getBytes(StandardCharsets.UTF_8));
            } catch (RuntimeException ex) {
                logger.warn("delayed send job publish failed; retry after lease delayedJobId={} leaseUntil={}",
                        job.delayedJobId(),
                        leaseUntil,
                        ex);
                continue;
            }
            int deleted = delayedSendJobRepository.delete(job.delayedJobId(), lockedBy);
            if (deleted == 0) {
                logger.warn("delayed send job published but lock was lost delayedJobId={}", job.delayedJobId());
            }
            relayed++;
        }
        metrics.updateRelayBacklogCurrent(delayedSendJobRepository.countPending());
        if (relayed > 0) {
            logger.info("delayed send jobs relayed count={} claimed={}", relayed, due.size());
        }
        return relayed;
    }

    @VisibleForTesting
    String resolveLockedBy() {
        String env = System.getenv(HOSTNAME_ENV);
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException ex) {
            logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
            return DEFAULT_HOSTNAME;
        }
    }
}
