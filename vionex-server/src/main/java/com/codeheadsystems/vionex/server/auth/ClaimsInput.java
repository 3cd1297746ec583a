package com.codeheadsystems.vionex.server.auth;

import java.util.Objects;

/**
 * The caller-supplied part of a token's claims. Timestamps and the token ID are added at issuance.
 *
 * @param subject  account identifier
 * @param username account username
 * @param role     account role
 */
public record ClaimsInput(String subject, String username, Role role) {

  public ClaimsInput {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(role, "role");
  }
}
