/*
 * どこで: Certificate API
 * 何を: 証明書 1 件の参照結果を表す
 * なぜ: 発行時の記録と現在の保管者を並べて返すため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.popchain.certificate.model.CertificateCustody;
import com.popchain.certificate.model.CertificateNft;
import java.util.UUID;

/** {@code issued_to} はウォレット未連携で発行された場合 null になる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CertificateResponse(
    UUID certificateId,
    String eventId,
    String tierName,
    String url,
    String tierUrl,
    String issuedTo,
    long issuedAt,
    long mintPrice,
    String custodian) {

  public static CertificateResponse from(CertificateCustody custody) {
    final CertificateNft certificate = custody.certificate();
    return new CertificateResponse(
        certificate.id(),
        certificate.eventId(),
        certificate.tierName(),
        certificate.url(),
        certificate.tierUrl(),
        certificate.issuedTo().orElse(null),
        certificate.issuedAt(),
        certificate.mintPrice(),
        custody.custodianAddress());
  }
}
