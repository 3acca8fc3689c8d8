/*
 * どこで: Send Worker サービス層
 * 何を: 遅延再投入するジョブを delayed_send_jobs に保存する
 * なぜ: JetStream には遅延 publish が無いため、可視時刻を DB に持たせて中継させるため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.DelayedSendJob;
import com.example.sendworker.model.SendJob;
import com.example.sendworker.repository.DelayedSendJobRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DelayedSendQueue implements SendQueue {

    private static final Logger logger = LoggerFactory.getLogger(DelayedSendQueue.class);

    private final DelayedSendJobRepository delayedSendJobRepository;
    private final SendJobCodec codec;
    private final Clock clock;

    @Override
    public void sendDelayed(SendJob job, Duration delay) {
        Instant now = Instant.now(clock);
        Instant visibleAt = now.plus(delay);
        DelayedSendJob delayedJob = new DelayedSendJob(
                UUID.randomUUID(),
                job.notificationId(),
                job.recipientId(),
                new String(codec.encode(job), StandardCharsets.UTF_8),
                visibleAt,
                null,
                null,
                now);
        // 保存失敗は握りつぶさず呼び出し元の障害経路へ流す(失うとジョブが消える)
        delayedSendJobRepository.insert(delayedJob);
        logger.info("send job delayed notificationId={} recipientId={} visibleAt={} delayedJobId={}",
                job.notificationId(),
                job.recipientId(),
                visibleAt,
                delayedJob.delayedJobId());
    }
}
