package com.codeheadsystems.vionex.server.manager;

import com.codeheadsystems.vionex.server.auth.Claims;
import com.codeheadsystems.vionex.server.store.Account;

/**
 * Outcome of a successful login.
 *
 * @param account          the authenticated account
 * @param claims           claims of the access token
 * @param accessToken      signed access token
 * @param refreshToken     signed refresh token, bound to the account's session
 * @param expiresInSeconds access token lifetime
 */
public record LoginResult(
    Account account,
    Claims claims,
    String accessToken,
    String refreshToken,
    long expiresInSeconds) {

  @Override
  public String toString() {
    return "LoginResult[account=" + account + ", claims=" + claims + "]";
  }
}
