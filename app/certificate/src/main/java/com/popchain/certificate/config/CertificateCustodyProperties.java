/*
 * どこで: Certificate アプリの設定バインド
 * 何を: ウォレット未連携アカウント向けのエスクロー先 (サービスウォレット) を保持する
 * なぜ: 環境ごとに保管先ウォレットを切り替えられるようにするため
 */
package com.popchain.certificate.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "certificate.custody")
public record CertificateCustodyProperties(@NotBlank String serviceWalletAddress) {}
