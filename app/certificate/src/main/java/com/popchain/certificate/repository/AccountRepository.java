/*
 * どこで: Certificate データアクセス
 * 何を: アカウントモジュールの所有者アドレスと証明書 ID リストを読み書きする
 * なぜ: 発行/移転の判定に必要な最小限のアカウント操作だけを提供するため
 */
package com.popchain.certificate.repository;

import com.popchain.certificate.model.CertificateAccount;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
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
public class AccountRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CertificateAccount> findById(String accountId) {
    final String sql =
        """
        SELECT account_id, owner_address
        FROM certificate_accounts
        WHERE account_id = :accountId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<CertificateAccount> findByIdForUpdate(String accountId) {
    // 同一アカウントへの発行/移転をトランザクション終了まで直列化する
    final String sql =
        """
        SELECT account_id, owner_address
        FROM certificate_accounts
        WHERE account_id = :accountId
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UUID> findCertificateIds(String accountId) {
    final String sql =
        """
        SELECT certificate_id
        FROM account_certificates
        WHERE account_id = :accountId
        ORDER BY position
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("certificate_id")));
  }

  /** 証明書 ID をリスト末尾に追加し、採番した位置 (0 始まり) を返す。 */
  public int appendCertificate(String accountId, UUID certificateId) {
    // 集約のみの SELECT は対象行が無くても 1 行返るため、空リストは位置 0 になる
    final String sql =
        """
        INSERT INTO account_certificates (account_id, position, certificate_id)
        SELECT :accountId, COALESCE(MAX(position) + 1, 0), :certificateId
        FROM account_certificates
        WHERE account_id = :accountId
        RETURNING position
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("certificateId", certificateId);
    final Integer position = jdbcTemplate.queryForObject(sql, params, Integer.class);
    if (position == null) {
      throw new IllegalStateException("certificate append returned no position");
    }
    return position;
  }

  private CertificateAccount mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CertificateAccount(
        rs.getString("account_id"), Optional.ofNullable(rs.getString("owner_address")));
  }
}
