/*
 * どこで: Certificate ドメインモデル
 * 何を: 発行済み証明書 (NFT) のスナップショットを表す
 * なぜ: 発行時点の受取人/ティア/価格を監査履歴として固定するため
 */
package com.popchain.certificate.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 発行済みの証明書。全項目が発行後に不変。
 *
 * <p>{@code issuedTo} は発行時点の受取人であり、その後のウォレット移転では更新されない。
 * 現在の保管者 (custody) は台帳側の {@code custodian_address} で管理する。
 * 空の場合は、発行時にアカウントがウォレット未連携だったことを表す。
 */
public record CertificateNft(
        UUID id,
        String eventId,
        String tierName,
        String url,
        String tierUrl,
        Optional<String> issuedTo,
        long issuedAt,
        long mintPrice) {

    public CertificateNft {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(issuedTo, "issuedTo");
    }

    /** ティアを消費して証明書を組み立てる。 */
    public static CertificateNft fromTier(
            UUID id,
            String eventId,
            String url,
            Tier tier,
            Optional<String> issuedTo,
            long issuedAt) {
        return new CertificateNft(
                id,
                eventId,
                tier.name(),
                url,
                tier.url(),
                issuedTo,
                issuedAt,
                tier.price());
    }
}
