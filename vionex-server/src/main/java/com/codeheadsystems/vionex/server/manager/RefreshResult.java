package com.codeheadsystems.vionex.server.manager;

/**
 * Outcome of a successful refresh.
 *
 * @param accessToken      newly issued access token
 * @param refreshToken     refresh token the client should use next; unchanged unless rotation is enabled
 * @param expiresInSeconds access token lifetime
 */
public record RefreshResult(String accessToken, String refreshToken, long expiresInSeconds) {

  @Override
  public String toString() {
    return "RefreshResult[expiresInSeconds=" + expiresInSeconds + "]";
  }
}
