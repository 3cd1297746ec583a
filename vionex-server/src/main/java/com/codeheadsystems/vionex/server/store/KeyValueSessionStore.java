package com.codeheadsystems.vionex.server.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} keeping the refresh token at {@code session:<userId>} in a shared
 * {@link KeyValueStore}, expiring with the refresh token lifetime.
 */
public class KeyValueSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(KeyValueSessionStore.class);

  static final String KEY_PREFIX = "session:";

  private final KeyValueStore store;
  private final Clock clock;

  public KeyValueSessionStore(KeyValueStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public Session create(String userId, String refreshToken, Duration ttl) {
    Instant now = clock.instant();
    store.set(key(userId), refreshToken, ttl);
    log.debug("Created session for user {} (ttl {})", userId, ttl);
    return new Session(userId, refreshToken, now, now.plus(ttl));
  }

  @Override
  public boolean verify(String userId, String refreshToken) {
    if (refreshToken == null) {
      return false;
    }
    Optional<String> stored = store.get(key(userId));
    if (stored.isEmpty()) {
      log.debug("No live session for user {}", userId);
      return false;
    }
    return MessageDigest.isEqual(
        stored.get().getBytes(StandardCharsets.UTF_8),
        refreshToken.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void invalidate(String userId) {
    store.delete(key(userId));
    log.debug("Invalidated session for user {}", userId);
  }

  static String key(String userId) {
    return KEY_PREFIX + userId;
  }
}
