/*
 * どこで: TransferAuthorizer のユニットテスト
 * 何を: ウォレット移転の前提条件の順序と成功時の保管先更新を検証する
 * なぜ: 他人の証明書やアカウント外の証明書を引き出せないことを保証するため
 */
package com.popchain.certificate.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.popchain.certificate.api.AccountNotFoundException;
import com.popchain.certificate.api.CertificateNotFoundException;
import com.popchain.certificate.api.InvalidAddressException;
import com.popchain.certificate.api.UnauthorizedCertificateException;
import com.popchain.certificate.ledger.LedgerContext;
import com.popchain.certificate.model.CertificateAccount;
import com.popchain.certificate.model.CertificateCustody;
import com.popchain.certificate.model.CertificateNft;
import com.popchain.certificate.repository.AccountRepository;
import com.popchain.certificate.repository.CertificateRepository;
import com.popchain.certificate.repository.OutboxEventRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransferAuthorizerTest {

  private static final long NOW_MILLIS = Instant.parse("2026-03-02T00:00:00Z").toEpochMilli();
  private static final UUID CERTIFICATE_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");
  private static final UUID OTHER_ID = UUID.fromString("44444444-4444-4444-4444-444444444444");
  private static final UUID EVENT_ID = UUID.fromString("55555555-5555-5555-5555-555555555555");
  private static final String ACCOUNT_ID = "acct-1";
  private static final String OWNER = "0xABC";

  @Mock private AccountRepository accountRepository;

  @Mock private CertificateRepository certificateRepository;

  @Mock private OutboxEventRepository outboxEventRepository;

  @Mock private LedgerContext ledgerContext;

  @Mock private CertificateMetrics metrics;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private TransferAuthorizer authorizer;

  @BeforeEach
  void setUp() {
    final CertificateAuditLog auditLog =
        new CertificateAuditLog(outboxEventRepository, ledgerContext, objectMapper);
    authorizer =
        new TransferAuthorizer(
            accountRepository, certificateRepository, auditLog, ledgerContext, metrics);
  }

  @Test
  void transferFailsWithInvalidAddressWhenAccountIsUnlinked() {
    // 受取人不一致かつ未登録でも、未連携チェックが最初に効く
    stub(new CertificateAccount(ACCOUNT_ID, Optional.empty()), certificate(Optional.of("0xOTHER")),
        List.of());

    assertThatThrownBy(() -> authorizer.transferCertificateToWallet(ACCOUNT_ID, CERTIFICATE_ID, null))
        .isInstanceOf(InvalidAddressException.class)
        .hasMessage(TransferAuthorizer.MESSAGE_NOT_LINKED);

    verify(certificateRepository, never()).updateCustodian(any(UUID.class), anyString(), any(Instant.class));
    verifyNoInteractions(outboxEventRepository);
    verify(metrics).recordCommand(CertificateMetrics.ACTION_TRANSFER, "invalid_address");
  }

  @Test
  void transferFailsWhenRecordedRecipientDiffers() {
    stub(linkedAccount(), certificate(Optional.of("0xOTHER")), List.of(CERTIFICATE_ID));

    assertThatThrownBy(() -> authorizer.transferCertificateToWallet(ACCOUNT_ID, CERTIFICATE_ID, null))
        .isInstanceOf(UnauthorizedCertificateException.class)
        .hasMessage(TransferAuthorizer.MESSAGE_RECIPIENT_MISMATCH);

    verifyNoInteractions(outboxEventRepository);
    verify(metrics).recordCommand(CertificateMetrics.ACTION_TRANSFER, "unauthorized");
  }

  @Test
  void transferFailsWhenCertificateIsNotRegisteredEvenIfRecipientMatches() {
    stub(linkedAccount(), certificate(Optional.of(OWNER)), List.of(OTHER_ID));

    assertThatThrownBy(() -> authorizer.transferCertificateToWallet(ACCOUNT_ID, CERTIFICATE_ID, null))
        .isInstanceOf(UnauthorizedCertificateException.class)
        .hasMessage(TransferAuthorizer.MESSAGE_NOT_REGISTERED);

    verify(certificateRepository, never()).updateCustodian(any(UUID.class), anyString(), any(Instant.class));
  }

  @Test
  void transferMovesCustodyToOwnerAndKeepsIssuedTo() throws Exception {
    final CertificateNft certificate = certificate(Optional.of(OWNER));
    stub(linkedAccount(), certificate, List.of(OTHER_ID, CERTIFICATE_ID));
    stubLedger();

    final String destination =
        authorizer.transferCertificateToWallet(ACCOUNT_ID, CERTIFICATE_ID, "trace-9");

    assertThat(destination).isEqualTo(OWNER);
    verify(certificateRepository)
        .updateCustodian(CERTIFICATE_ID, OWNER, Instant.ofEpochMilli(NOW_MILLIS));
    verify(certificateRepository, never())
        .insert(any(CertificateNft.class), anyString(), any(Instant.class));
    assertThat(certificate.issuedTo()).contains(OWNER);

    final JsonNode event = captureOutboxPayload();
    assertThat(event.get("event_type").asText()).isEqualTo("CertificateTransferredToWallet");
    assertThat(event.get("certificate_id").asText()).isEqualTo(CERTIFICATE_ID.toString());
    assertThat(event.get("account_id").asText()).isEqualTo(ACCOUNT_ID);
    assertThat(event.get("destination").asText()).isEqualTo(OWNER);
    assertThat(event.get("trace_id").asText()).isEqualTo("trace-9");
    verify(metrics).recordCommand(CertificateMetrics.ACTION_TRANSFER, CertificateMetrics.RESULT_SUCCESS);
  }

  @Test
  void transferReleasesEscrowedCertificateAfterAccountLinksWallet() {
    // エスクロー中 (issued_to 空) の証明書は、後から連携したウォレットへ引き出せる
    final CertificateNft escrowed = certificate(Optional.empty());
    stub(linkedAccount(), escrowed, List.of(CERTIFICATE_ID));
    stubLedger();

    final String destination =
        authorizer.transferCertificateToWallet(ACCOUNT_ID, CERTIFICATE_ID, null);

    assertThat(destination).isEqualTo(OWNER);
    verify(certificateRepository)
        .updateCustodian(eq(CERTIFICATE_ID), eq(OWNER), any(Instant.class));
    // 発行時の記録は空のまま残る
    assertThat(escrowed.issuedTo()).isEmpty();
  }

  @Test
  void transferFailsWhenAccountIsUnknown() {
    when(accountRepository.findByIdForUpdate("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> authorizer.transferCertificateToWallet("missing", CERTIFICATE_ID, null))
        .isInstanceOf(AccountNotFoundException.class);

    verifyNoInteractions(certificateRepository, outboxEventRepository);
    verify(metrics)
        .recordCommand(CertificateMetrics.ACTION_TRANSFER, CertificateMetrics.RESULT_NOT_FOUND);
  }

  @Test
  void transferFailsWhenCertificateIsUnknown() {
    when(accountRepository.findByIdForUpdate(ACCOUNT_ID)).thenReturn(Optional.of(linkedAccount()));
    when(certificateRepository.findByIdForUpdate(CERTIFICATE_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> authorizer.transferCertificateToWallet(ACCOUNT_ID, CERTIFICATE_ID, null))
        .isInstanceOf(CertificateNotFoundException.class)
        .hasMessage("certificate not found: " + CERTIFICATE_ID);
    verify(metrics)
        .recordCommand(CertificateMetrics.ACTION_TRANSFER, CertificateMetrics.RESULT_NOT_FOUND);
  }

  @Test
  void authorizeReturnsOwnerWhenAllChecksPass() {
    assertThat(TransferAuthorizer.authorize(
            linkedAccount(), certificate(Optional.of(OWNER)), List.of(CERTIFICATE_ID)))
        .isEqualTo(OWNER);
  }

  private void stub(CertificateAccount account, CertificateNft certificate, List<UUID> registered) {
    when(accountRepository.findByIdForUpdate(ACCOUNT_ID)).thenReturn(Optional.of(account));
    when(certificateRepository.findByIdForUpdate(CERTIFICATE_ID))
        .thenReturn(Optional.of(new CertificateCustody(certificate, "0xFEED")));
    when(accountRepository.findCertificateIds(ACCOUNT_ID)).thenReturn(registered);
  }

  private void stubLedger() {
    when(ledgerContext.currentTimeMillis()).thenReturn(NOW_MILLIS);
    when(ledgerContext.newObjectId()).thenReturn(EVENT_ID);
  }

  private JsonNode captureOutboxPayload() throws Exception {
    final ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);
    verify(outboxEventRepository)
        .append(eq(EVENT_ID), eq("CertificateTransferredToWallet"), eq(CERTIFICATE_ID.toString()),
            payloadCaptor.capture(), eq(Instant.ofEpochMilli(NOW_MILLIS)));
    return objectMapper.readTree(payloadCaptor.getValue());
  }

  private static CertificateAccount linkedAccount() {
    return new CertificateAccount(ACCOUNT_ID, Optional.of(OWNER));
  }

  private static CertificateNft certificate(Optional<String> issuedTo) {
    return new CertificateNft(
        CERTIFICATE_ID, "E1", "PopBadge", "https://meta", "https://art", issuedTo, 1L, 30_000_000L);
  }
}
