/*
 * どこで: Certificate API
 * 何を: 証明書の発行/ウォレット移転/参照のエンドポイントを提供する
 * なぜ: アプリの公開インターフェースを明確にするため
 */
package com.popchain.certificate.api;

import com.popchain.certificate.config.CertificateCustodyProperties;
import com.popchain.certificate.model.Tier;
import com.popchain.certificate.service.CertificateQueryService;
import com.popchain.certificate.service.CertificateRegistry;
import com.popchain.certificate.service.TierCatalog;
import com.popchain.certificate.service.TransferAuthorizer;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.RequiredArgsConstructor;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class CertificateController {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";

    private final CertificateRegistry certificateRegistry;
    private final TransferAuthorizer transferAuthorizer;
    private final CertificateQueryService queryService;
    private final CertificateCustodyProperties custodyProperties;

    @PostMapping("/certificates")
    public ResponseEntity<MintCertificateResponse> mint(
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @Valid @RequestBody MintCertificateRequest request) {
        TierRequest tierRequest = request.tier();
        Tier tier = TierCatalog.createTier(
                tierRequest.name(), tierRequest.description(), tierRequest.url(), tierRequest.price());
        UUID certificateId = certificateRegistry.mintCertificate(
                request.eventId(),
                request.url(),
                tier,
                request.accountId(),
                custodyProperties.serviceWalletAddress(),
                traceId);
        return ResponseEntity.ok(new MintCertificateResponse(certificateId, request.accountId()));
    }

    @PostMapping("/certificates/{certificate_id}/transfers")
    public ResponseEntity<TransferCertificateResponse> transfer(
            @PathVariable("certificate_id") UUID certificateId,
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @Valid @RequestBody TransferCertificateRequest request) {
        String destination = transferAuthorizer.transferCertificateToWallet(
                request.accountId(), certificateId, traceId);
        return ResponseEntity.ok(
                new TransferCertificateResponse(certificateId, request.accountId(), destination));
    }

    @GetMapping("/certificates/{certificate_id}")
    public CertificateResponse get(@PathVariable("certificate_id") UUID certificateId) {
        return CertificateResponse.from(queryService.getCertificate(certificateId));
    }

    @GetMapping("/accounts/{account_id}/certificates")
    public AccountCertificatesResponse listByAccount(
            @PathVariable("account_id")
            @NotBlank(message = "account_id is required")
            String accountId) {
        return new AccountCertificatesResponse(accountId, queryService.listAccountCertificates(accountId));
    }
}
