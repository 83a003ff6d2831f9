/*
 * どこで: Certificate API
 * 何を: ウォレット移転リクエストの入力を保持する
 * なぜ: 移転先アカウントを明示して受け取るため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransferCertificateRequest(
    @NotBlank(message = "account_id is required") String accountId) {}
