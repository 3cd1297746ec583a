package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned by {@code POST /auth/refresh}.
 * <p>
 * {@code refreshToken} is the same token the client sent unless the server rotates
 * refresh tokens, in which case the old one is no longer accepted.
 *
 * @param accessToken  newly issued access token
 * @param refreshToken refresh token to use next time
 * @param tokenType    always {@code Bearer}
 * @param expiresIn    access token lifetime in seconds
 */
public record RefreshResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn) {
}
