/*
 * どこで: Certificate API
 * 何を: ウォレット未連携アカウントへの直接移転 (409) を表す例外を定義する
 * なぜ: 移転先アドレスが存在しない状態を明確に扱うため
 */
package com.popchain.certificate.api;

public class InvalidAddressException extends RuntimeException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
