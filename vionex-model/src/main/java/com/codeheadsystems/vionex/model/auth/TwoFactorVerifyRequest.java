package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param secret Base32-encoded shared secret
 * @param code   six-digit code entered by the user
 */
public record TwoFactorVerifyRequest(
    @JsonProperty("secret") String secret,
    @JsonProperty("code") String code) {
}
