package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a password login.
 * <p>
 * The {@code username} field accepts either the account's username or its email address.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param username username or email address of the account
 * @param password plaintext password; never logged or echoed back
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[username=" + username + ", password=<redacted>]";
  }
}
