/*
 * どこで: Certificate API
 * 何を: 発行結果のレスポンスを表す
 * なぜ: 採番された証明書 ID を呼び出し元へ返すため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MintCertificateResponse(UUID certificateId, String accountId) {}
