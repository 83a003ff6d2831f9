/*
 * どこで: Certificate API
 * 何を: ティア一括生成の入力配列の長さ不一致 (400) を表す例外を定義する
 * なぜ: 添字範囲外の失敗ではなく明示的なエラーとして返すため
 */
package com.popchain.certificate.api;

public class TierLengthMismatchException extends RuntimeException {

    public TierLengthMismatchException(String message) {
        super(message);
    }
}
