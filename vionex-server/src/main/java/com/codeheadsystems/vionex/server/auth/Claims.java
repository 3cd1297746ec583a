package com.codeheadsystems.vionex.server.auth;

import java.time.Instant;

/**
 * The signed payload of an access or refresh token. Never stored server side.
 *
 * @param tokenId   unique token ID ({@code jti})
 * @param subject   account identifier ({@code sub})
 * @param username  account username
 * @param role      account role
 * @param issuedAt  issuance time, millisecond precision
 * @param expiresAt first instant at which the token is no longer valid, millisecond precision
 */
public record Claims(
    String tokenId,
    String subject,
    String username,
    Role role,
    Instant issuedAt,
    Instant expiresAt) {
}
