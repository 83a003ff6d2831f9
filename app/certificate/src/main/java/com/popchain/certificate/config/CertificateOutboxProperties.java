/*
 * どこで: Certificate アプリの設定バインド
 * 何を: Outbox publish のポーリング/リトライ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.popchain.certificate.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "certificate.outbox")
public record CertificateOutboxProperties(
        boolean enabled,
        Duration pollInterval,
        int batchSize,
        int maxAttempts,
        Duration backoffBase,
        Duration backoffMax,
        double backoffExponentBase,
        double backoffJitterMin,
        double backoffJitterMax,
        Duration backoffMin,
        int errorMessageMaxLength,
        Duration lease) {
}
