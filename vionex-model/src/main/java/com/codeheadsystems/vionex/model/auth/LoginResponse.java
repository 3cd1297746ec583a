package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned after a successful login.
 * <p>
 * {@code expiresIn} describes the access token only. The refresh token lives for the
 * configured refresh lifetime and is bound to the account's single server-side session.
 *
 * @param accessToken  short-lived bearer token for API calls
 * @param refreshToken long-lived token accepted only by {@code /auth/refresh} and {@code /auth/logout}
 * @param tokenType    always {@code Bearer}
 * @param expiresIn    access token lifetime in seconds
 * @param user         summary of the authenticated account
 */
public record LoginResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("user") UserSummary user) {
}
