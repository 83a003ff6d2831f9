/*
 * どこで: Certificate 台帳インタフェースの実装
 * 何を: Clock と UUID で台帳時刻と ID 採番を提供する
 * なぜ: Clock Bean を共通化し、時刻注入を TimeConfig に揃えるため
 */
package com.popchain.certificate.ledger;

import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ClockLedgerContext implements LedgerContext {

    private final Clock clock;

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    @Override
    public UUID newObjectId() {
        return UUID.randomUUID();
    }
}
