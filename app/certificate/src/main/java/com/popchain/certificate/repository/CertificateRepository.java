/*
 * どこで: Certificate データアクセス
 * 何を: 証明書の登録/参照と保管者 (custody) の更新を行う
 * なぜ: 発行時スナップショットと現在の保管先を台帳上で一貫して扱うため
 */
package com.popchain.certificate.repository;

import static com.popchain.common.JdbcTimestampUtils.toTimestamp;

import com.popchain.certificate.model.CertificateCustody;
import com.popchain.certificate.model.CertificateNft;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class CertificateRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT certificate_id,
             event_id,
             tier_name,
             url,
             tier_url,
             issued_to,
             issued_at,
             mint_price,
             custodian_address
      FROM certificates
      WHERE certificate_id = :certificateId
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(CertificateNft certificate, String custodianAddress, Instant custodyUpdatedAt) {
    final String sql =
        """
        INSERT INTO certificates (
          certificate_id,
          event_id,
          tier_name,
          url,
          tier_url,
          issued_to,
          issued_at,
          mint_price,
          custodian_address,
          custody_updated_at
        ) VALUES (
          :certificateId,
          :eventId,
          :tierName,
          :url,
          :tierUrl,
          :issuedTo,
          :issuedAt,
          :mintPrice,
          :custodianAddress,
          :custodyUpdatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("certificateId", certificate.id())
            .addValue("eventId", certificate.eventId())
            .addValue("tierName", certificate.tierName())
            .addValue("url", certificate.url())
            .addValue("tierUrl", certificate.tierUrl())
            // ウォレット未連携は NULL で保存する
            .addValue("issuedTo", certificate.issuedTo().orElse(null))
            .addValue("issuedAt", certificate.issuedAt())
            .addValue("mintPrice", certificate.mintPrice())
            .addValue("custodianAddress", custodianAddress)
            .addValue("custodyUpdatedAt", toTimestamp(custodyUpdatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<CertificateCustody> findById(UUID certificateId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("certificateId", certificateId);
    return jdbcTemplate.query(SELECT_COLUMNS, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<CertificateCustody> findByIdForUpdate(UUID certificateId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("certificateId", certificateId);
    return jdbcTemplate.query(SELECT_COLUMNS + "FOR UPDATE", params, this::mapRow).stream()
        .findFirst();
  }

  /** 保管者のみを更新する。issued_to は発行時の値のまま残す。 */
  public int updateCustodian(UUID certificateId, String custodianAddress, Instant updatedAt) {
    final String sql =
        """
        UPDATE certificates
        SET custodian_address = :custodianAddress,
            custody_updated_at = :updatedAt
        WHERE certificate_id = :certificateId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("custodianAddress", custodianAddress)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("certificateId", certificateId);
    return jdbcTemplate.update(sql, params);
  }

  private CertificateCustody mapRow(ResultSet rs, int rowNum) throws SQLException {
    final CertificateNft certificate =
        new CertificateNft(
            UUID.fromString(rs.getString("certificate_id")),
            rs.getString("event_id"),
            rs.getString("tier_name"),
            rs.getString("url"),
            rs.getString("tier_url"),
            Optional.ofNullable(rs.getString("issued_to")),
            rs.getLong("issued_at"),
            rs.getLong("mint_price"));
    return new CertificateCustody(certificate, rs.getString("custodian_address"));
  }
}
