/*
 * どこで: Certificate outbox publish サービス
 * 何を: outbox_events を claim して監査イベントを JetStream へ publish する
 * なぜ: 台帳更新とイベント配信の整合性を保つため
 */
package com.popchain.certificate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.popchain.certificate.config.CertificateNatsProperties;
import com.popchain.certificate.config.CertificateOutboxProperties;
import com.popchain.certificate.model.OutboxEventRecord;
import com.popchain.certificate.model.OutboxStatus;
import com.popchain.certificate.repository.OutboxEventRepository;
import com.popchain.common.event.CertificateEventPayload;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(
    name = "certificate.outbox.enabled",
    havingValue = "true",
    matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class CertificateOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(CertificateOutboxPublisher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";
  private static final Set<String> KNOWN_EVENT_TYPES =
      Set.of(
          CertificateEventPayload.CERTIFICATE_MINTED,
          CertificateEventPayload.CERTIFICATE_TRANSFERRED_TO_WALLET);

  private final JetStream jetStream;
  private final OutboxEventRepository outboxEventRepository;
  private final CertificateOutboxProperties properties;
  private final CertificateNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final CertificateMetrics metrics;
  private final Clock clock;

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final List<OutboxEventRecord> pending =
        outboxEventRepository.claimPending(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    for (OutboxEventRecord record : pending) {
      try {
        final CertificateEventPayload payload = parsePayload(record);
        final Instant occurredAt = Instant.parse(payload.occurredAt());
        metrics.recordOutboxBacklogAge(occurredAt, now);
        final PublishAck ack =
            jetStream.publish(
                natsProperties.subject(),
                buildHeaders(record, payload),
                record.payloadJson().getBytes(StandardCharsets.UTF_8));
        if (ack == null) {
          throw new IllegalStateException("puback is missing");
        }
        if (outboxEventRepository.markPublished(record.eventId(), lockedBy, now) == 0) {
          logger.warn("outbox publish succeeded but lock was lost eventId={}", record.eventId());
        } else {
          metrics.recordOutboxPublishDelay(occurredAt, now);
        }
      } catch (JetStreamApiException | IOException | RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countFailed());
  }

  private CertificateEventPayload parsePayload(OutboxEventRecord record) {
    if (!KNOWN_EVENT_TYPES.contains(record.eventType())) {
      throw new OutboxPayloadParseException("unknown event type: " + record.eventType(), null);
    }
    try {
      return objectMapper.readValue(record.payloadJson(), CertificateEventPayload.class);
    } catch (JsonProcessingException ex) {
      // パース不能はリトライしても回復しないため即時 FAILED に寄せる
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private Headers buildHeaders(OutboxEventRecord record, CertificateEventPayload payload) {
    final Headers headers = new Headers();
    // event_id を重複排除キーとして NATS 標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_AGGREGATE_KEY, record.aggregateKey());
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    headers.add(HEADER_TRACE_ID, payload.traceId());
    return headers;
  }

  private void handleFailure(OutboxEventRecord record, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxEventRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "outbox retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (nonRetryable) {
      logger.error(
          "outbox payload rejected and moved to FAILED eventId={}", record.eventId(), ex);
    } else if (failed) {
      logger.warn("outbox publish moved to FAILED eventId={}", record.eventId(), ex);
    } else {
      logger.warn(
          "outbox publish retry scheduled eventId={} attempt={} nextRetryAt={}",
          record.eventId(),
          nextAttempt,
          nextRetryAt,
          ex);
    }
  }

  private Duration computeBackoffDuration(int attempt) {
    final double exp =
        properties.backoffBase().toMillis()
            * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitter =
        properties.backoffJitterMin()
            + ThreadLocalRandom.current().nextDouble()
                * (properties.backoffJitterMax() - properties.backoffJitterMin());
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
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

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
