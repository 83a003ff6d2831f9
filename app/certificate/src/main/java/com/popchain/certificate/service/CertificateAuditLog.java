/*
 * どこで: Certificate サービス層
 * 何を: 発行/ウォレット移転の監査イベントを outbox へ追記する
 * なぜ: 台帳更新と同じトランザクションでイベントを確定させ、失敗時は一緒に破棄するため
 */
package com.popchain.certificate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.popchain.certificate.ledger.LedgerContext;
import com.popchain.certificate.model.CertificateNft;
import com.popchain.certificate.repository.OutboxEventRepository;
import com.popchain.common.event.CertificateEventPayload;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class CertificateAuditLog {

    private final OutboxEventRepository outboxEventRepository;
    private final LedgerContext ledgerContext;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public CertificateEventPayload recordMinted(CertificateNft certificate, String traceId) {
        UUID eventId = ledgerContext.newObjectId();
        CertificateEventPayload payload = CertificateEventPayload.minted(
                eventId.toString(),
                Instant.ofEpochMilli(certificate.issuedAt()).toString(),
                certificate.id().toString(),
                certificate.eventId(),
                certificate.tierName(),
                certificate.issuedTo().orElse(null),
                certificate.issuedAt(),
                certificate.mintPrice(),
                traceId);
        append(eventId, payload, certificate.id(), certificate.issuedAt());
        return payload;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public CertificateEventPayload recordTransferredToWallet(
            UUID certificateId, String accountId, String destination, String traceId) {
        UUID eventId = ledgerContext.newObjectId();
        long occurredAt = ledgerContext.currentTimeMillis();
        CertificateEventPayload payload = CertificateEventPayload.transferredToWallet(
                eventId.toString(),
                Instant.ofEpochMilli(occurredAt).toString(),
                certificateId.toString(),
                accountId,
                destination,
                traceId);
        append(eventId, payload, certificateId, occurredAt);
        return payload;
    }

    private void append(UUID eventId, CertificateEventPayload payload, UUID certificateId, long occurredAt) {
        outboxEventRepository.append(
                eventId,
                payload.eventType(),
                certificateId.toString(),
                toJson(payload),
                Instant.ofEpochMilli(occurredAt));
    }

    private String toJson(CertificateEventPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize outbox payload", ex);
        }
    }
}
