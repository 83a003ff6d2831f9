/*
 * どこで: Certificate API
 * 何を: ティア 1 件分の入力を保持する
 * なぜ: 発行リクエストにティアを埋め込んで受け取るため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TierRequest(
    @NotNull(message = "tier.name is required") String name,
    @NotNull(message = "tier.description is required") String description,
    @NotNull(message = "tier.url is required") String url,
    @NotNull(message = "tier.price is required")
        @PositiveOrZero(message = "tier.price must not be negative")
        Long price) {}
