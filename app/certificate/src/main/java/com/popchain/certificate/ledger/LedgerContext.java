/*
 * どこで: Certificate 台帳インタフェース
 * 何を: 台帳が提供する現在時刻と一意 ID の採番を抽象化する
 * なぜ: テストで決定的な時刻/ID を注入できるようにするため
 */
package com.popchain.certificate.ledger;

import java.util.UUID;

public interface LedgerContext {

    /** 台帳時刻 (エポックミリ秒)。 */
    long currentTimeMillis();

    /** グローバルに一意なオブジェクト ID を採番する。 */
    UUID newObjectId();
}
