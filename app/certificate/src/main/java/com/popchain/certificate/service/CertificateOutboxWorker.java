/*
 * どこで: Certificate outbox ワーカー
 * 何を: スケジュールで outbox publish を起動する
 * なぜ: 定期的に未送信の監査イベントを処理するため
 */
package com.popchain.certificate.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "certificate.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class CertificateOutboxWorker {

    private final CertificateOutboxPublisher publisher;

    @Scheduled(fixedDelayString = "${certificate.outbox.poll-interval}")
    public void run() {
        publisher.publishPendingBatch();
    }
}
