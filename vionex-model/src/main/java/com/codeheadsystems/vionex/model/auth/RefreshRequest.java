package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model carrying a refresh token.
 * <p>
 * Used by: {@code POST /auth/refresh} and {@code POST /auth/logout}
 *
 * @param refreshToken the refresh token issued at login
 */
public record RefreshRequest(@JsonProperty("refresh_token") String refreshToken) {
}
