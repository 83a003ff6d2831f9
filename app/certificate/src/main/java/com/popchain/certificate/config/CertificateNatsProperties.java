/*
 * どこで: Certificate アプリの設定バインド
 * 何を: 監査イベントの publish 先 subject と JetStream stream 設定を保持する
 * なぜ: publish と重複排除の前提となる stream を環境で揃えるため
 */
package com.popchain.certificate.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "certificate.nats")
public record CertificateNatsProperties(
        @NotBlank String subject,
        @NotBlank String stream,
        @NotNull Duration duplicateWindow) {
}
