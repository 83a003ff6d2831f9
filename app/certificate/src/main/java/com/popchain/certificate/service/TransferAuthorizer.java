/*
 * どこで: Certificate サービス層
 * 何を: 証明書がアカウントに属することを検証してから、連携ウォレットへ保管を移す
 * なぜ: 他アカウントの証明書やエスクロー外の証明書の引き出しを防ぐため
 */
package com.popchain.certificate.service;

import com.popchain.certificate.api.AccountNotFoundException;
import com.popchain.certificate.api.ApiErrorCode;
import com.popchain.certificate.api.CertificateNotFoundException;
import com.popchain.certificate.api.InvalidAddressException;
import com.popchain.certificate.api.UnauthorizedCertificateException;
import com.popchain.certificate.ledger.LedgerContext;
import com.popchain.certificate.model.CertificateAccount;
import com.popchain.certificate.model.CertificateNft;
import com.popchain.certificate.repository.AccountRepository;
import com.popchain.certificate.repository.CertificateRepository;
import com.popchain.common.TraceIds;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TransferAuthorizer {

    static final String MESSAGE_NOT_LINKED =
            "account not linked to a wallet cannot receive a direct transfer";
    static final String MESSAGE_RECIPIENT_MISMATCH =
            "certificate's recorded recipient differs from this account";
    static final String MESSAGE_NOT_REGISTERED = "certificate not registered to this account";

    private final AccountRepository accountRepository;
    private final CertificateRepository certificateRepository;
    private final CertificateAuditLog auditLog;
    private final LedgerContext ledgerContext;
    private final CertificateMetrics metrics;

    /**
     * 証明書の保管をアカウントの連携ウォレットへ移す。検証は次の順で行い、最初の失敗で中断する。
     * <ol>
     *   <li>アカウントがウォレット連携済みであること
     *   <li>issued_to が空 (エスクロー中) か、アカウントの所有者と一致すること
     *   <li>証明書 ID がアカウントの証明書リストに含まれること
     * </ol>
     * issued_to は発行時の記録として残し、更新しない。
     *
     * @return 移転先のウォレットアドレス
     */
    @Transactional
    public String transferCertificateToWallet(String accountId, UUID certificateId, String traceId) {
        CertificateAccount account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> notFound(new AccountNotFoundException(accountId)));
        CertificateNft certificate = certificateRepository.findByIdForUpdate(certificateId)
                .orElseThrow(() -> notFound(new CertificateNotFoundException(certificateId)))
                .certificate();
        List<UUID> registered = accountRepository.findCertificateIds(accountId);

        String destination;
        try {
            destination = authorize(account, certificate, registered);
        } catch (InvalidAddressException ex) {
            metrics.recordCommand(CertificateMetrics.ACTION_TRANSFER, resultOf(ApiErrorCode.INVALID_ADDRESS));
            throw ex;
        } catch (UnauthorizedCertificateException ex) {
            metrics.recordCommand(CertificateMetrics.ACTION_TRANSFER, resultOf(ApiErrorCode.UNAUTHORIZED));
            log.warn("certificate transfer rejected certificateId={} accountId={} reason={}",
                    certificateId, accountId, ex.getMessage());
            throw ex;
        }

        certificateRepository.updateCustodian(
                certificateId, destination, Instant.ofEpochMilli(ledgerContext.currentTimeMillis()));
        auditLog.recordTransferredToWallet(certificateId, accountId, destination, TraceIds.resolve(traceId));
        metrics.recordCommand(CertificateMetrics.ACTION_TRANSFER, CertificateMetrics.RESULT_SUCCESS);
        log.info("certificate transferred to wallet certificateId={} accountId={} destination={}",
                certificateId, accountId, destination);
        return destination;
    }

    static String authorize(CertificateAccount account, CertificateNft certificate, List<UUID> registered) {
        Optional<String> owner = account.ownerAddress();
        if (owner.isEmpty()) {
            throw new InvalidAddressException(MESSAGE_NOT_LINKED);
        }
        Optional<String> issuedTo = certificate.issuedTo();
        if (issuedTo.isPresent() && !issuedTo.get().equals(owner.get())) {
            throw new UnauthorizedCertificateException(MESSAGE_RECIPIENT_MISMATCH);
        }
        if (!registered.contains(certificate.id())) {
            throw new UnauthorizedCertificateException(MESSAGE_NOT_REGISTERED);
        }
        return owner.get();
    }

    private RuntimeException notFound(RuntimeException ex) {
        metrics.recordCommand(CertificateMetrics.ACTION_TRANSFER, CertificateMetrics.RESULT_NOT_FOUND);
        return ex;
    }

    private static String resultOf(ApiErrorCode code) {
        return code.name().toLowerCase(Locale.ROOT);
    }
}
