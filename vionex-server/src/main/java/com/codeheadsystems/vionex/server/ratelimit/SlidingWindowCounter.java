package com.codeheadsystems.vionex.server.ratelimit;

import com.codeheadsystems.vionex.server.store.KeyValueStore;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Counts events for a key within a trailing time window, one sorted-set member per event.
 * <p>
 * Members are {@code <epochMillis>:<uuid>} scored by epoch milliseconds, so two events in the
 * same millisecond are both kept. An event at {@code t} counts at {@code now} while
 * {@code t > now - window}.
 * <p>
 * This class makes no admit or deny decision. Its calls are separate store round trips and
 * are not atomic with respect to each other.
 */
public class SlidingWindowCounter {

  private final KeyValueStore store;

  public SlidingWindowCounter(KeyValueStore store) {
    this.store = store;
  }

  /**
   * Records one event and refreshes the key's idle expiry to {@code window}.
   */
  public void record(String key, Instant timestamp, Duration window) {
    long millis = timestamp.toEpochMilli();
    store.sortedSetAdd(key, millis, millis + ":" + UUID.randomUUID());
    store.expire(key, window);
  }

  /**
   * @return number of recorded events with timestamp in {@code (now - window, +inf)}
   */
  public long countWithinWindow(String key, Instant now, Duration window) {
    return store.sortedSetCountAbove(key, windowStart(now, window));
  }

  /**
   * Removes events with timestamp at or before {@code now - window}.
   */
  public void evictExpired(String key, Instant now, Duration window) {
    store.sortedSetRemoveUpTo(key, windowStart(now, window));
  }

  /**
   * Forgets every event for the key.
   */
  public void clear(String key) {
    store.delete(key);
  }

  private static long windowStart(Instant now, Duration window) {
    return now.minus(window).toEpochMilli();
  }
}
