/*
 * どこで: Certificate API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.popchain.certificate.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    NOT_FOUND,
    INVALID_ADDRESS,
    UNAUTHORIZED,
    LENGTH_MISMATCH,
    ENCODING_FAILURE
}
