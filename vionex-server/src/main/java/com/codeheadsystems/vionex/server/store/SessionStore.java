package com.codeheadsystems.vionex.server.store;

import com.codeheadsystems.vionex.server.error.StoreUnavailableException;
import java.time.Duration;

/**
 * Tracks the one live refresh token per user.
 * <p>
 * Implementations must be thread-safe. Each user has a single session slot: creating a session
 * replaces any previous one, which makes the previous refresh token unusable.
 * <p>
 * Every method throws {@link StoreUnavailableException} when the backing store cannot be reached.
 * A store failure is never reported as "no session".
 */
public interface SessionStore {

  /**
   * Binds {@code refreshToken} to {@code userId}, replacing any existing session.
   *
   * @return the stored session
   */
  Session create(String userId, String refreshToken, Duration ttl);

  /**
   * @return true only if a live session exists for {@code userId} and its token equals
   *     {@code refreshToken} exactly
   */
  boolean verify(String userId, String refreshToken);

  /**
   * Removes the session for {@code userId}. No-op if none exists.
   */
  void invalidate(String userId);
}
