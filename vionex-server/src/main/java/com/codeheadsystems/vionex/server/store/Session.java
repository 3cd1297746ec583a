package com.codeheadsystems.vionex.server.store;

import java.time.Instant;

/**
 * A user's single live refresh session.
 *
 * @param userId    account identifier
 * @param token     the refresh token bound to the session
 * @param createdAt when the session was created
 * @param expiresAt when the store will forget the session
 */
public record Session(String userId, String token, Instant createdAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "Session[userId=" + userId + ", createdAt=" + createdAt + ", expiresAt=" + expiresAt + "]";
  }
}
