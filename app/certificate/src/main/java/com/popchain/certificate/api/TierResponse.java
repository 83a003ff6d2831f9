/*
 * どこで: Certificate API
 * 何を: ティアのレスポンスを表す
 * なぜ: ドメインの Tier を JSON 表現へ写すため
 */
package com.popchain.certificate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.popchain.certificate.model.Tier;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TierResponse(String name, String description, String url, long price) {

  public static TierResponse from(Tier tier) {
    return new TierResponse(tier.name(), tier.description(), tier.url(), tier.price());
  }
}
