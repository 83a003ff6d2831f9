/*
 * どこで: Certificate API
 * 何を: 証明書が存在しない (404) ことを表す例外を定義する
 * なぜ: 存在しない ID への操作を明確に扱うため
 */
package com.popchain.certificate.api;

import java.util.UUID;

public class CertificateNotFoundException extends RuntimeException {

    public CertificateNotFoundException(UUID certificateId) {
        super("certificate not found: " + certificateId);
    }
}
