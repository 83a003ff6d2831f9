/*
 * どこで: Certificate API
 * 何を: 証明書発行リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MintCertificateRequest(
    @NotBlank(message = "event_id is required") String eventId,
    @NotBlank(message = "url is required") String url,
    @NotBlank(message = "account_id is required") String accountId,
    @NotNull(message = "tier is required") @Valid TierRequest tier) {}
