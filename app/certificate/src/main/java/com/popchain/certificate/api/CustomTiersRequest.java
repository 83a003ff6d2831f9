/*
 * どこで: Certificate API
 * 何を: カスタムティア生成用の並行リスト入力を保持する
 * なぜ: 添字で対応付ける 4 本のリストをそのまま受け取るため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomTiersRequest(
    @NotNull(message = "names is required")
        List<@NotNull(message = "names must not contain null") String> names,
    @NotNull(message = "descriptions is required")
        List<@NotNull(message = "descriptions must not contain null") String> descriptions,
    @NotNull(message = "urls is required")
        List<@NotNull(message = "urls must not contain null") String> urls,
    @NotNull(message = "prices is required")
        List<
                @NotNull(message = "prices must not contain null")
                @PositiveOrZero(message = "prices must not be negative") Long>
            prices) {}
