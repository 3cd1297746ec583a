package com.codeheadsystems.vionex.server.store;

import com.codeheadsystems.vionex.server.error.StoreUnavailableException;
import java.time.Duration;
import java.util.Optional;

/**
 * The subset of Redis semantics the authentication core relies on.
 * <p>
 * Implementations must be thread-safe and shared by every worker of every server process
 * that should see the same sessions and windows. Every method throws
 * {@link StoreUnavailableException} when the store cannot be reached or times out; callers
 * must never treat that as an empty result.
 * <p>
 * Sorted-set scores are epoch milliseconds.
 */
public interface KeyValueStore {

  /**
   * Adds a member to the sorted set at {@code key}, creating the set if needed.
   */
  void sortedSetAdd(String key, long score, String member);

  /**
   * Removes every member whose score is less than or equal to {@code maxScoreInclusive}.
   *
   * @return number of members removed
   */
  long sortedSetRemoveUpTo(String key, long maxScoreInclusive);

  /**
   * Counts members whose score is strictly greater than {@code minScoreExclusive}.
   *
   * @return the count, 0 if the key does not exist
   */
  long sortedSetCountAbove(String key, long minScoreExclusive);

  /**
   * Sets or refreshes the idle expiry of {@code key}. No-op if the key does not exist.
   */
  void expire(String key, Duration ttl);

  Optional<String> get(String key);

  /**
   * Stores {@code value} at {@code key}, replacing any previous value, expiring after {@code ttl}.
   */
  void set(String key, String value, Duration ttl);

  /**
   * Deletes {@code key}. No-op if it does not exist.
   */
  void delete(String key);

  /**
   * Round-trips to the store.
   *
   * @throws StoreUnavailableException if the store does not answer
   */
  void ping();
}
