/*
 * どこで: Certificate API
 * 何を: base64 で符号化されたティア入力を保持する
 * なぜ: 生バイト列の厳密な文字コード検証を API 越しに行うため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EncodedTierRequest(
    @NotNull(message = "name is required") String name,
    @NotNull(message = "description is required") String description,
    @NotNull(message = "url is required") String url,
    @NotNull(message = "price is required")
        @PositiveOrZero(message = "price must not be negative")
        Long price) {}
