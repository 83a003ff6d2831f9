/*
 * どこで: common のイベント payload 定義
 * 何を: 証明書の監査イベント (発行/ウォレット移転) の outbox payload を表す
 * なぜ: publisher と購読側で同一のペイロード形状を共有するため
 */
package com.popchain.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 監査イベントの共通エンベロープ。
 *
 * <p>{@code CertificateMinted} は event_ref から mint_price までを、
 * {@code CertificateTransferredToWallet} は account_id と destination を持つ。
 * 未使用の項目は null のまま JSON から省かれる。issued_to が null の場合は
 * 発行時点でウォレット未連携だったことを意味する。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CertificateEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String certificateId,
    String eventRef,
    String tierName,
    String issuedTo,
    Long issuedAt,
    Long mintPrice,
    String accountId,
    String destination,
    String traceId) {

  public static final String CERTIFICATE_MINTED = "CertificateMinted";
  public static final String CERTIFICATE_TRANSFERRED_TO_WALLET = "CertificateTransferredToWallet";

  public static CertificateEventPayload minted(
      String eventId,
      String occurredAt,
      String certificateId,
      String eventRef,
      String tierName,
      String issuedTo,
      long issuedAt,
      long mintPrice,
      String traceId) {
    return new CertificateEventPayload(
        eventId,
        CERTIFICATE_MINTED,
        occurredAt,
        certificateId,
        eventRef,
        tierName,
        issuedTo,
        issuedAt,
        mintPrice,
        null,
        null,
        traceId);
  }

  public static CertificateEventPayload transferredToWallet(
      String eventId,
      String occurredAt,
      String certificateId,
      String accountId,
      String destination,
      String traceId) {
    return new CertificateEventPayload(
        eventId,
        CERTIFICATE_TRANSFERRED_TO_WALLET,
        occurredAt,
        certificateId,
        null,
        null,
        null,
        null,
        null,
        accountId,
        destination,
        traceId);
  }
}
