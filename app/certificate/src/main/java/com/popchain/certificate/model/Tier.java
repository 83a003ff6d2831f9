/*
 * どこで: Certificate ドメインモデル
 * 何を: 価格付きの証明書ティア (テンプレート) を表す
 * なぜ: 発行時にティアの内容をそのまま証明書へスナップショットするため
 */
package com.popchain.certificate.model;

import java.util.Objects;

/**
 * 証明書の種類を表す不変のテンプレート。
 *
 * @param name ティア名
 * @param description 説明文
 * @param url アートワークの参照先 (ASCII)
 * @param price 発行価格 (最小通貨単位、負値不可)
 */
public record Tier(String name, String description, String url, long price) {

    public Tier {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(url, "url");
        if (price < 0) {
            throw new IllegalArgumentException("price must not be negative");
        }
    }
}
