/*
 * どこで: Certificate API
 * 何を: ティア一覧のレスポンスを表す
 * なぜ: 並び順を保ったまま返すため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TiersResponse(List<TierResponse> tiers) {
  public TiersResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (tiers != null) {
      tiers = Collections.unmodifiableList(new ArrayList<>(tiers));
    }
  }

  @Override
  public List<TierResponse> tiers() {
    if (tiers == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(tiers));
  }
}
