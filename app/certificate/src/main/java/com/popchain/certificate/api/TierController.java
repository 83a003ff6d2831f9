/*
 * どこで: Certificate API
 * 何を: ティアの既定ラダー/バイト列からの生成/カスタム生成のエンドポイントを提供する
 * なぜ: 発行前にティアの内容を確認・検証できるようにするため
 */
package com.popchain.certificate.api;

import com.popchain.certificate.model.Tier;
import com.popchain.certificate.service.TierCatalog;

import jakarta.validation.Valid;
import java.util.Base64;
import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tiers")
public class TierController {

    @GetMapping("/defaults")
    public TiersResponse defaults() {
        return toResponse(TierCatalog.defaultPopchainTiers());
    }

    @PostMapping("/decode")
    public TierResponse decode(@Valid @RequestBody EncodedTierRequest request) {
        Tier tier = TierCatalog.createTierFromBytes(
                decodeBase64("name", request.name()),
                decodeBase64("description", request.description()),
                decodeBase64("url", request.url()),
                request.price());
        return TierResponse.from(tier);
    }

    @PostMapping("/custom")
    public TiersResponse custom(@Valid @RequestBody CustomTiersRequest request) {
        return toResponse(TierCatalog.createCustomTiers(
                request.names(), request.descriptions(), request.urls(), request.prices()));
    }

    private static TiersResponse toResponse(List<Tier> tiers) {
        return new TiersResponse(tiers.stream().map(TierResponse::from).toList());
    }

    private static byte[] decodeBase64(String field, String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(field + " must be base64 encoded", ex);
        }
    }
}
