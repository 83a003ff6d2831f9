/*
 * どこで: Certificate API
 * 何を: ティアのバイト列が文字列/URL として不正 (400) であることを表す例外を定義する
 * なぜ: 不正なエンコーディングを黙って置換しないため
 */
package com.popchain.certificate.api;

public class TierEncodingException extends RuntimeException {

    public TierEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
