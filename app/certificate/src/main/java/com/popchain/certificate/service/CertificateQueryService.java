/*
 * どこで: Certificate サービス層
 * 何を: 証明書とアカウントの証明書リストを読み取り専用で参照する
 * なぜ: 発行時スナップショットと現在の保管先を副作用なしで返すため
 */
package com.popchain.certificate.service;

import com.popchain.certificate.api.AccountNotFoundException;
import com.popchain.certificate.api.CertificateNotFoundException;
import com.popchain.certificate.model.CertificateCustody;
import com.popchain.certificate.repository.AccountRepository;
import com.popchain.certificate.repository.CertificateRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CertificateQueryService {

    private final CertificateRepository certificateRepository;
    private final AccountRepository accountRepository;

    public CertificateCustody getCertificate(UUID certificateId) {
        return certificateRepository.findById(certificateId)
                .orElseThrow(() -> new CertificateNotFoundException(certificateId));
    }

    public List<UUID> listAccountCertificates(String accountId) {
        if (accountRepository.findById(accountId).isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        return accountRepository.findCertificateIds(accountId);
    }
}
