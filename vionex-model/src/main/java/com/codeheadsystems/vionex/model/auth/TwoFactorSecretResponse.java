package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a freshly generated two-factor secret.
 *
 * @param secret Base32-encoded shared secret
 */
public record TwoFactorSecretResponse(@JsonProperty("secret") String secret) {
}
