/*
 * どこで: Certificate API
 * 何を: アカウントの証明書 ID 一覧のレスポンスを表す
 * なぜ: account_id と発行順の ID リストを明示的に返すため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountCertificatesResponse(String accountId, List<UUID> certificateIds) {
  public AccountCertificatesResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (certificateIds != null) {
      certificateIds = Collections.unmodifiableList(new ArrayList<>(certificateIds));
    }
  }

  @Override
  public List<UUID> certificateIds() {
    // SpotBugs の EI_EXPOSE_REP 対応: 内部の不変リストを直接返さず毎回コピーして返す
    if (certificateIds == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(certificateIds));
  }
}
