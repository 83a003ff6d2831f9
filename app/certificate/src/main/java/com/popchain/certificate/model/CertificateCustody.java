/*
 * どこで: Certificate ドメインモデル
 * 何を: 証明書と現在の保管者アドレスの組を表す
 * なぜ: 発行時スナップショット (issued_to) と現在の保管先を区別して返すため
 */
package com.popchain.certificate.model;

public record CertificateCustody(CertificateNft certificate, String custodianAddress) {}
