/*
 * どこで: Certificate サービス層
 * 何を: ティアと参加イベントから証明書を発行し、保管先の決定とアカウントへの登録を行う
 * なぜ: 発行・リスト追記・監査イベントを 1 トランザクションで確定させるため
 */
package com.popchain.certificate.service;

import com.popchain.certificate.api.AccountNotFoundException;
import com.popchain.certificate.ledger.LedgerContext;
import com.popchain.certificate.model.CertificateAccount;
import com.popchain.certificate.model.CertificateNft;
import com.popchain.certificate.model.Tier;
import com.popchain.certificate.repository.AccountRepository;
import com.popchain.certificate.repository.CertificateRepository;
import com.popchain.common.TraceIds;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateRegistry {

    private final AccountRepository accountRepository;
    private final CertificateRepository certificateRepository;
    private final CertificateAuditLog auditLog;
    private final LedgerContext ledgerContext;
    private final CertificateMetrics metrics;

    /**
     * 証明書を発行する。支払いの確認は呼び出し前に済んでいる前提で、価格は記録のみ行う。
     *
     * <p>アカウントがウォレット未連携なら保管先はサービスウォレット (エスクロー)、
     * 連携済みなら所有者アドレスになる。issued_to にはどちらの場合も発行時点の所有者
     * (未連携なら空) を記録する。
     *
     * @return 採番した証明書 ID
     * @throws AccountNotFoundException アカウントが存在しない場合
     */
    @Transactional
    public UUID mintCertificate(
            String eventId,
            String url,
            Tier tier,
            String accountId,
            String serviceWalletAddress,
            String traceId) {
        long issuedAt = ledgerContext.currentTimeMillis();
        Optional<CertificateAccount> found = accountRepository.findByIdForUpdate(accountId);
        if (found.isEmpty()) {
            metrics.recordCommand(CertificateMetrics.ACTION_MINT, CertificateMetrics.RESULT_NOT_FOUND);
            throw new AccountNotFoundException(accountId);
        }
        CertificateAccount account = found.get();
        Optional<String> owner = account.ownerAddress();

        CertificateNft certificate = CertificateNft.fromTier(
                ledgerContext.newObjectId(), eventId, url, tier, owner, issuedAt);
        String custodian = owner.orElse(serviceWalletAddress);
        certificateRepository.insert(certificate, custodian, Instant.ofEpochMilli(issuedAt));

        int position = accountRepository.appendCertificate(accountId, certificate.id());
        auditLog.recordMinted(certificate, TraceIds.resolve(traceId));
        metrics.recordCommand(CertificateMetrics.ACTION_MINT, CertificateMetrics.RESULT_SUCCESS);
        log.info("certificate minted certificateId={} accountId={} tier={} custodian={} escrow={} position={}",
                certificate.id(),
                accountId,
                certificate.tierName(),
                custodian,
                owner.isEmpty(),
                position);
        return certificate.id();
    }
}
