/*
 * どこで: Certificate サービス層
 * 何を: 発行/移転の結果と outbox 遅延/失敗のメトリクス記録を集約する
 * なぜ: 拒否率と監査イベント配信の遅れを運用で継続監視できるようにするため
 */
package com.popchain.certificate.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class CertificateMetrics {

  public static final String ACTION_MINT = "MINT";
  public static final String ACTION_TRANSFER = "TRANSFER";
  public static final String RESULT_SUCCESS = "success";
  public static final String RESULT_NOT_FOUND = "not_found";

  private static final String METRIC_COMMAND_TOTAL = "certificate.command.total";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "certificate.outbox.publish.delay";
  private static final String METRIC_OUTBOX_BACKLOG_AGE = "certificate.outbox.backlog.age";
  private static final String METRIC_OUTBOX_FAILED_CURRENT = "certificate.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final Timer outboxPublishDelayTimer;
  private final Timer outboxBacklogAgeTimer;

  public CertificateMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED certificate outbox events")
        .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from audit event creation to JetStream publish")
            .register(meterRegistry);
    this.outboxBacklogAgeTimer =
        Timer.builder(METRIC_OUTBOX_BACKLOG_AGE)
            .description("Age of an audit event when it is claimed by the publisher")
            .register(meterRegistry);
  }

  /** result は success か、拒否時の ApiErrorCode を小文字化した値。 */
  public void recordCommand(String action, String result) {
    commandCounters
        .computeIfAbsent(
            action + ":" + result,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Certificate mint/transfer executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordOutboxPublishDelay(Instant createdAt, Instant publishedAt) {
    if (isOrdered(createdAt, publishedAt)) {
      outboxPublishDelayTimer.record(Duration.between(createdAt, publishedAt));
    }
  }

  public void recordOutboxBacklogAge(Instant createdAt, Instant observedAt) {
    if (isOrdered(createdAt, observedAt)) {
      outboxBacklogAgeTimer.record(Duration.between(createdAt, observedAt));
    }
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }

  private boolean isOrdered(Instant from, Instant to) {
    return from != null && to != null && !to.isBefore(from);
  }
}
