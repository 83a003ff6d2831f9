/*
 * どこで: Certificate サービス層
 * 何を: 証明書ティアの生成 (単体/バイト列/既定ラダー/一括) を提供する
 * なぜ: 発行前のティア組み立てを副作用なしで共通化するため
 */
package com.popchain.certificate.service;

import com.popchain.certificate.api.TierEncodingException;
import com.popchain.certificate.api.TierLengthMismatchException;
import com.popchain.certificate.model.Tier;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class TierCatalog {

    public static final long POP_PASS_PRICE = 10_000_000L;
    public static final long POP_BADGE_PRICE = 30_000_000L;
    public static final long POP_MEDAL_PRICE = 50_000_000L;
    public static final long POP_TROPHY_PRICE = 70_000_000L;

    private static final String ARTWORK_BASE_URL = "https://assets.popchain.app/tiers/";

    // 添字がティア番号になるため順序を変えないこと
    private static final List<Tier> DEFAULT_TIERS = List.of(
            new Tier(
                    "PopPass",
                    "Entry-level proof of participation for attending the event",
                    ARTWORK_BASE_URL + "pop-pass.png",
                    POP_PASS_PRICE),
            new Tier(
                    "PopBadge",
                    "Badge for attendees who took part in the event activities",
                    ARTWORK_BASE_URL + "pop-badge.png",
                    POP_BADGE_PRICE),
            new Tier(
                    "PopMedal",
                    "Medal for outstanding contribution during the event",
                    ARTWORK_BASE_URL + "pop-medal.png",
                    POP_MEDAL_PRICE),
            new Tier(
                    "PopTrophy",
                    "Trophy reserved for the event's top participants",
                    ARTWORK_BASE_URL + "pop-trophy.png",
                    POP_TROPHY_PRICE));

    private TierCatalog() {}

    public static Tier createTier(String name, String description, String url, long price) {
        return new Tier(name, description, url, price);
    }

    /**
     * バイト列からティアを生成する。名前と説明は UTF-8、URL は ASCII として厳密に復号する。
     *
     * @throws TierEncodingException いずれかのバイト列が不正な場合
     */
    public static Tier createTierFromBytes(
            byte[] nameBytes, byte[] descriptionBytes, byte[] urlBytes, long price) {
        String name = decode("name", nameBytes, StandardCharsets.UTF_8);
        String description = decode("description", descriptionBytes, StandardCharsets.UTF_8);
        String url = decode("url", urlBytes, StandardCharsets.US_ASCII);
        return createTier(name, description, url, price);
    }

    /** PopPass, PopBadge, PopMedal, PopTrophy の順で既定ラダーを返す。 */
    public static List<Tier> defaultPopchainTiers() {
        return DEFAULT_TIERS;
    }

    /**
     * 4 本の並行リストを添字ごとに束ねてティアを生成する。
     *
     * @throws TierLengthMismatchException リストの長さが揃っていない場合
     */
    public static List<Tier> createCustomTiers(
            List<String> names, List<String> descriptions, List<String> urls, List<Long> prices) {
        int length = names.size();
        if (descriptions.size() != length || urls.size() != length || prices.size() != length) {
            throw new TierLengthMismatchException(String.format(
                    "tier inputs must have equal length: names=%d descriptions=%d urls=%d prices=%d",
                    names.size(),
                    descriptions.size(),
                    urls.size(),
                    prices.size()));
        }
        List<Tier> tiers = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            tiers.add(createTier(names.get(i), descriptions.get(i), urls.get(i), prices.get(i)));
        }
        return List.copyOf(tiers);
    }

    private static String decode(String field, byte[] bytes, Charset charset) {
        if (bytes == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new TierEncodingException(field + " is not valid " + charset.name(), ex);
        }
    }
}
