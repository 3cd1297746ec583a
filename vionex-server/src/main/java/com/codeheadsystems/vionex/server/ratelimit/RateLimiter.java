package com.codeheadsystems.vionex.server.ratelimit;

import com.codeheadsystems.vionex.server.config.WindowConfig;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admits at most {@code maxEvents} calls per key within any trailing window.
 * <p>
 * Denied calls are not recorded, so a caller hammering a closed window does not extend it.
 * <p>
 * The evict, count and record steps are separate store calls. Requests racing on the same key
 * can each observe a count below the limit and all be admitted, so under contention the limit
 * can be exceeded by up to the number of concurrent racers. The limiter is a deterrent, not a
 * hard cap.
 */
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  static final String KEY_PREFIX = "ratelimit:";

  private final SlidingWindowCounter counter;
  private final WindowConfig config;
  private final Clock clock;

  public RateLimiter(SlidingWindowCounter counter, WindowConfig config, Clock clock) {
    this.counter = counter;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Admits and records one event for {@code key} if the window has room.
   *
   * @param key caller-chosen key, e.g. {@code 203.0.113.7:/auth/login}
   * @return true if admitted and recorded, false if denied
   */
  public boolean checkAndRecord(String key) {
    String storeKey = KEY_PREFIX + key;
    Instant now = clock.instant();
    counter.evictExpired(storeKey, now, config.window());
    long count = counter.countWithinWindow(storeKey, now, config.window());
    if (count >= config.maxEvents()) {
      log.debug("Rate limit exceeded for {} ({} of {})", key, count, config.maxEvents());
      return false;
    }
    counter.record(storeKey, now, config.window());
    return true;
  }

  public WindowConfig config() {
    return config;
  }
}
