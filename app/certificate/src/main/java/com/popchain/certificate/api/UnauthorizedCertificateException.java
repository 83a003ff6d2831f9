/*
 * どこで: Certificate API
 * 何を: 証明書とアカウントの所有関係の不一致 (403) を表す例外を定義する
 * なぜ: 他人の証明書の引き出しを拒否するため
 */
package com.popchain.certificate.api;

public class UnauthorizedCertificateException extends RuntimeException {

    public UnauthorizedCertificateException(String message) {
        super(message);
    }
}
