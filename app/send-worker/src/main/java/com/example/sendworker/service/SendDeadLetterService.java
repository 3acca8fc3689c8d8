/*
 * どこで: Send Worker サービス層
 * 何を: dead-letter になった送信キューメッセージを記録し、初回登録時だけ件数を数える
 * なぜ: 再配信上限の到達と TERM のどちらで失われたメッセージも後から特定できるようにするため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.DeadLetterReason;
import com.example.sendworker.repository.SendDeadLetterRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendDeadLetterService {

    private static final Logger logger = LoggerFactory.getLogger(SendDeadLetterService.class);

    private final SendDeadLetterRepository deadLetterRepository;
    private final SendMetrics metrics;
    private final Clock clock;

    public void record(long streamSeq, DeadLetterReason reason, long deliveries) {
        boolean inserted = deadLetterRepository.insertIfAbsent(streamSeq, reason, deliveries, Instant.now(clock));
        if (!inserted) {
            // advisory の再配信。件数は初回だけ数える
            logger.debug("send dead-letter already recorded streamSeq={} reason={}", streamSeq, reason.code());
            return;
        }
        metrics.recordDeadLetter(reason);
        logger.error("send queue message dead-lettered streamSeq={} reason={} deliveries={}",
                streamSeq,
                reason.code(),
                deliveries);
    }
}
