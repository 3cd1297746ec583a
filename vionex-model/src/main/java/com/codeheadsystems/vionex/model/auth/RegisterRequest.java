package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for creating an account.
 * <p>
 * Only structural checks are applied server side: username of 3 to 50 word characters,
 * a plausible email address, and a password between 8 characters and 72 UTF-8 bytes.
 * New accounts always start with the viewer role.
 *
 * @param username desired username
 * @param email    email address
 * @param password plaintext password; never logged or echoed back
 */
public record RegisterRequest(
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "RegisterRequest[username=" + username + ", email=" + email + ", password=<redacted>]";
  }
}
