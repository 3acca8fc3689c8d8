/*
 * どこで: Send Worker サービス層
 * 何を: 送信結果/スロットル応答数/キュー滞留時間/中継 backlog/dead-letter のメトリクスを記録する
 * なぜ: レート制限下での送信状況を Prometheus から直接観測できるようにするため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.DeadLetterReason;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SendMetrics {

  public static final String RESULT_SUCCEEDED = "succeeded";
  public static final String RESULT_THROTTLED = "throttled";
  public static final String RESULT_FAILED = "failed";
  public static final String RESULT_DEFERRED = "deferred";
  public static final String RESULT_FORCE_STOPPED = "force_stopped";
  public static final String RESULT_FAULT_CONTINUE = "fault_continue";
  public static final String RESULT_FAULT_TERMINAL = "fault_terminal";
  public static final String RESULT_DISCARDED = "discarded";

  private static final String METRIC_OUTCOME_TOTAL = "send.outcome.total";
  private static final String METRIC_THROTTLE_RESPONSES_TOTAL = "send.throttle.responses.total";
  private static final String METRIC_QUEUE_LATENCY = "send.queue.latency";
  private static final String METRIC_RELAY_BACKLOG_CURRENT = "send.relay.backlog.current";
  private static final String METRIC_DEAD_LETTER_TOTAL = "send.dead_letter.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger relayBacklogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final Counter throttleResponsesCounter;
  private final Map<DeadLetterReason, Counter> deadLetterCounters =
      new EnumMap<>(DeadLetterReason.class);
  private final Timer queueLatencyTimer;

  public SendMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_RELAY_BACKLOG_CURRENT, relayBacklogCurrent, AtomicInteger::get)
        .description("Current number of delayed send jobs waiting to be relayed")
        .register(meterRegistry);
    this.throttleResponsesCounter =
        Counter.builder(METRIC_THROTTLE_RESPONSES_TOTAL)
            .description("Total number of rate-limit responses received from the channel")
            .register(meterRegistry);
    for (DeadLetterReason reason : DeadLetterReason.values()) {
      deadLetterCounters.put(
          reason,
          Counter.builder(METRIC_DEAD_LETTER_TOTAL)
              .description("Total number of send queue messages that ended in dead-letter state")
              .tags(Tags.of("reason", reason.code()))
              .register(meterRegistry));
    }
    this.queueLatencyTimer =
        Timer.builder(METRIC_QUEUE_LATENCY)
            .description("Delay from enqueue to the start of processing")
            .register(meterRegistry);
  }

  public void recordOutcome(String result) {
    outcomeCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_OUTCOME_TOTAL)
                    .description("Send invocation outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordThrottleResponses(int count) {
    if (count > 0) {
      throttleResponsesCounter.increment(count);
    }
  }

  public void recordQueueLatency(Instant enqueuedAt, Instant startedAt) {
    if (enqueuedAt == null || startedAt == null || startedAt.isBefore(enqueuedAt)) {
      return;
    }
    queueLatencyTimer.record(Duration.between(enqueuedAt, startedAt));
  }

  public void recordDeadLetter(DeadLetterReason reason) {
    deadLetterCounters.get(reason).increment();
  }

  public void updateRelayBacklogCurrent(int backlogCount) {
    relayBacklogCurrent.set(Math.max(backlogCount, 0));
  }
}
