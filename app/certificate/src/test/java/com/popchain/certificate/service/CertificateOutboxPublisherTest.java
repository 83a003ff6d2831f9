/*
 * どこで: Certificate outbox publish のユニットテスト
 * 何を: puback/失敗/パース失敗/重複排除ヘッダの挙動を検証する
 * なぜ: puback 受信時のみ publish 成功とみなし、失敗と非リトライを正しく扱うため
 */
package com.popchain.certificate.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CertificateOutboxPublisherTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-03T00:00:00Z");
  // application.yaml と同じ値で固定し、テストの揺れを防ぐ
  private static final CertificateOutboxProperties PROPERTIES =
      new CertificateOutboxProperties(
          true,
          Duration.ofSeconds(1),
          50,
          10,
          Duration.ofSeconds(1),
          Duration.ofMinutes(5),
          2.0d,
          0.5d,
          1.5d,
          Duration.ofMillis(500),
          1000,
          Duration.ofSeconds(30));
  private static final CertificateNatsProperties NATS_PROPERTIES =
      new CertificateNatsProperties(
          "popchain.certificate.events", "CERTIFICATE_EVENTS", Duration.ofMinutes(2));

  @Mock private JetStream jetStream;

  @Mock private OutboxEventRepository outboxEventRepository;

  @Mock private CertificateMetrics metrics;

  private ObjectMapper objectMapper;
  private CertificateOutboxPublisher publisher;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    objectMapper = new ObjectMapper();
    publisher =
        new CertificateOutboxPublisher(
            jetStream,
            outboxEventRepository,
            PROPERTIES,
            NATS_PROPERTIES,
            objectMapper,
            metrics,
            clock);
  }

  @Test
  void publishPendingBatchPublishesJsonWithDedupeHeader() throws Exception {
    final UUID eventId = UUID.randomUUID();
    final OutboxEventRecord record = buildMintedRecord(eventId);
    stubClaim(record);
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenReturn(mock(PublishAck.class));
    when(outboxEventRepository.markPublished(eq(eventId), anyString(), eq(FIXED_NOW)))
        .thenReturn(1);

    publisher.publishPendingBatch();

    final ArgumentCaptor<Headers> headersCaptor = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> bodyCaptor = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publish(eq(NATS_PROPERTIES.subject()), headersCaptor.capture(), bodyCaptor.capture());
    final Headers headers = headersCaptor.getValue();
    assertThat(headers.getFirst("Nats-Msg-Id")).isEqualTo(eventId.toString());
    assertThat(headers.getFirst("event_type")).isEqualTo("CertificateMinted");
    assertThat(headers.getFirst("aggregate_key")).isEqualTo(record.aggregateKey());
    assertThat(headers.getFirst("trace_id")).isEqualTo("trace-1");
    assertThat(new String(bodyCaptor.getValue(), StandardCharsets.UTF_8))
        .isEqualTo(record.payloadJson());
    verify(metrics).recordOutboxPublishDelay(FIXED_NOW.minusSeconds(5), FIXED_NOW);
  }

  @Test
  void publishPendingBatchMovesToFailedWhenPayloadParseFails() {
    final OutboxEventRecord record =
        new OutboxEventRecord(UUID.randomUUID(), "CertificateMinted", "cert-1", "{invalid_json", 0);
    stubClaim(record);
    when(outboxEventRepository.markFailure(
            eq(record.eventId()), anyString(), anyInt(), eq(OutboxStatus.FAILED), isNull(),
            anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    verifyNoInteractions(jetStream);
    verify(outboxEventRepository)
        .markFailure(
            eq(record.eventId()),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("outbox payload parse failure"));
  }

  @Test
  void publishPendingBatchMovesUnknownEventTypeToFailed() throws Exception {
    final UUID eventId = UUID.randomUUID();
    final OutboxEventRecord valid = buildMintedRecord(eventId);
    final OutboxEventRecord record =
        new OutboxEventRecord(eventId, "CertificateBurned", "cert-1", valid.payloadJson(), 0);
    stubClaim(record);
    when(outboxEventRepository.markFailure(
            eq(eventId), anyString(), anyInt(), eq(OutboxStatus.FAILED), isNull(), anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    verifyNoInteractions(jetStream);
    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("unknown event type: CertificateBurned"));
  }

  @Test
  void publishPendingBatchSchedulesRetryWhenPublishFails() throws Exception {
    final UUID eventId = UUID.randomUUID();
    final OutboxEventRecord record = buildMintedRecord(eventId);
    stubClaim(record);
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("nats publish failed"));
    when(outboxEventRepository.markFailure(
            eq(eventId), anyString(), anyInt(), eq(OutboxStatus.PENDING), any(Instant.class),
            anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    final ArgumentCaptor<Instant> nextRetryCaptor = ArgumentCaptor.forClass(Instant.class);
    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            nextRetryCaptor.capture(),
            eq("nats publish failed"));
    // 1 回目は base(1s) x jitter(0.5..1.5) の範囲に収まる
    assertThat(nextRetryCaptor.getValue())
        .isBetween(FIXED_NOW.plusMillis(500), FIXED_NOW.plusMillis(1500));
    verify(outboxEventRepository, never())
        .markPublished(any(UUID.class), anyString(), any(Instant.class));
  }

  @Test
  void publishPendingBatchMovesToFailedOnLastAttempt() throws Exception {
    final UUID eventId = UUID.randomUUID();
    final OutboxEventRecord fresh = buildMintedRecord(eventId);
    final OutboxEventRecord record =
        new OutboxEventRecord(
            eventId, fresh.eventType(), fresh.aggregateKey(), fresh.payloadJson(),
            PROPERTIES.maxAttempts() - 1);
    stubClaim(record);
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenReturn(null);
    when(outboxEventRepository.markFailure(
            eq(eventId), anyString(), anyInt(), eq(OutboxStatus.FAILED), isNull(), anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("puback is missing"));
  }

  @Test
  void publishPendingBatchTruncatesErrorMessage() throws Exception {
    final UUID eventId = UUID.randomUUID();
    final OutboxEventRecord record = buildMintedRecord(eventId);
    final String longMessage = "x".repeat(PROPERTIES.errorMessageMaxLength() + 5);
    final JetStreamApiException apiException = mock(JetStreamApiException.class);
    when(apiException.getMessage()).thenReturn(longMessage);
    stubClaim(record);
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenThrow(apiException);
    when(outboxEventRepository.markFailure(
            eq(eventId), anyString(), anyInt(), eq(OutboxStatus.PENDING), any(Instant.class),
            anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    final ArgumentCaptor<String> errorCaptor = ArgumentCaptor.forClass(String.class);
    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            any(Instant.class),
            errorCaptor.capture());
    assertThat(errorCaptor.getValue()).hasSize(PROPERTIES.errorMessageMaxLength());
  }

  @Test
  void publishPendingBatchUpdatesFailedGauge() {
    when(outboxEventRepository.claimPending(
            eq(PROPERTIES.batchSize()), eq(FIXED_NOW), any(Instant.class), anyString()))
        .thenReturn(List.of());
    when(outboxEventRepository.countFailed()).thenReturn(4);

    publisher.publishPendingBatch();

    verify(metrics).updateOutboxFailedCurrent(4);
    verifyNoInteractions(jetStream);
  }

  private void stubClaim(OutboxEventRecord record) {
    when(outboxEventRepository.claimPending(
            eq(PROPERTIES.batchSize()),
            eq(FIXED_NOW),
            eq(FIXED_NOW.plus(PROPERTIES.lease())),
            anyString()))
        .thenReturn(List.of(record));
  }

  private OutboxEventRecord buildMintedRecord(UUID eventId) throws JsonProcessingException {
    final UUID certificateId = UUID.randomUUID();
    final CertificateEventPayload payload =
        CertificateEventPayload.minted(
            eventId.toString(),
            FIXED_NOW.minusSeconds(5).toString(),
            certificateId.toString(),
            "E1",
            "PopBadge",
            "0xABC",
            FIXED_NOW.minusSeconds(5).toEpochMilli(),
            30_000_000L,
            "trace-1");
    return new OutboxEventRecord(
        eventId,
        CertificateEventPayload.CERTIFICATE_MINTED,
        certificateId.toString(),
        objectMapper.writeValueAsString(payload),
        0);
  }
}
