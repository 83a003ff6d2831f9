/*
 * どこで: Certificate ドメインモデル
 * 何を: アカウントモジュールから読み込むアカウントのスナップショットを表す
 * なぜ: ウォレット未連携を Optional で明示し、番兵アドレスを使わないため
 */
package com.popchain.certificate.model;

import java.util.Objects;
import java.util.Optional;

public record CertificateAccount(String accountId, Optional<String> ownerAddress) {

    public CertificateAccount {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(ownerAddress, "ownerAddress");
    }
}
