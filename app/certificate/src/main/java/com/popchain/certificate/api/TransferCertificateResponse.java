/*
 * どこで: Certificate API
 * 何を: ウォレット移転結果のレスポンスを表す
 * なぜ: 移転先アドレスを呼び出し元で確認できるようにするため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransferCertificateResponse(
    UUID certificateId, String accountId, String destination) {}
