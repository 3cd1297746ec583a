package com.codeheadsystems.vionex.server.ratelimit;

import com.codeheadsystems.vionex.server.config.WindowConfig;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locks an account out of password login after too many recent failures.
 * <p>
 * Lockout is purely a function of failure history: an account is blocked while at least
 * {@code maxEvents} failures fall inside the trailing window, and is unblocked by a successful
 * login or by the failures ageing out. There is no separate unlock action, so an attacker
 * pacing guesses at the window rate is never blocked.
 */
public class LoginAttemptTracker {

  private static final Logger log = LoggerFactory.getLogger(LoginAttemptTracker.class);

  static final String KEY_PREFIX = "login_attempts:";

  private final SlidingWindowCounter counter;
  private final WindowConfig config;
  private final Clock clock;

  public LoginAttemptTracker(SlidingWindowCounter counter, WindowConfig config, Clock clock) {
    this.counter = counter;
    this.config = config;
    this.clock = clock;
  }

  /**
   * On success deletes all failure history for the account. On failure records one event.
   */
  public void recordAttempt(String accountKey, boolean success) {
    String key = KEY_PREFIX + accountKey;
    if (success) {
      counter.clear(key);
      return;
    }
    Instant now = clock.instant();
    counter.evictExpired(key, now, config.window());
    counter.record(key, now, config.window());
    log.debug("Recorded failed login for account {}", accountKey);
  }

  /**
   * Read-only check. Must be consulted before verifying a password.
   */
  public boolean isBlocked(String accountKey) {
    long failures = counter.countWithinWindow(KEY_PREFIX + accountKey, clock.instant(), config.window());
    if (failures >= config.maxEvents()) {
      log.warn("Account {} is locked out after {} failed logins", accountKey, failures);
      return true;
    }
    return false;
  }
}
