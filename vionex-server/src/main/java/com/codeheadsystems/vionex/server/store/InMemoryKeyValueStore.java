package com.codeheadsystems.vionex.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link KeyValueStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * State is visible only inside this process, so sessions and rate windows are not shared
 * between server instances. Expired keys are lazily evicted on access. Suitable for
 * development and testing only.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  // Exactly one of value or sortedSet is non-null. Guarded by ConcurrentHashMap.compute.
  private static final class Entry {
    private final String value;
    private final Map<String, Long> sortedSet;
    private Instant expiresAt;

    private Entry(String value, Map<String, Long> sortedSet, Instant expiresAt) {
      this.value = value;
      this.sortedSet = sortedSet;
      this.expiresAt = expiresAt;
    }
  }

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryKeyValueStore() {
    this(Clock.systemUTC());
  }

  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryKeyValueStore - sessions and rate windows are NOT shared between "
        + "processes and do NOT survive restarts. Configure a Redis URI for production.");
  }

  @Override
  public void sortedSetAdd(String key, long score, String member) {
    entries.compute(key, (k, existing) -> {
      Entry entry = live(existing);
      if (entry == null) {
        entry = new Entry(null, new HashMap<>(), null);
      } else if (entry.sortedSet == null) {
        throw new IllegalStateException("Key holds a plain value, not a sorted set: " + k);
      }
      entry.sortedSet.put(member, score);
      return entry;
    });
  }

  @Override
  public long sortedSetRemoveUpTo(String key, long maxScoreInclusive) {
    AtomicLong removed = new AtomicLong();
    entries.computeIfPresent(key, (k, existing) -> {
      Entry entry = live(existing);
      if (entry == null || entry.sortedSet == null) {
        return entry;
      }
      int before = entry.sortedSet.size();
      entry.sortedSet.values().removeIf(score -> score <= maxScoreInclusive);
      removed.set(before - entry.sortedSet.size());
      // Redis deletes a sorted set once it is empty.
      return entry.sortedSet.isEmpty() ? null : entry;
    });
    return removed.get();
  }

  @Override
  public long sortedSetCountAbove(String key, long minScoreExclusive) {
    AtomicLong count = new AtomicLong();
    entries.computeIfPresent(key, (k, existing) -> {
      Entry entry = live(existing);
      if (entry != null && entry.sortedSet != null) {
        count.set(entry.sortedSet.values().stream().filter(score -> score > minScoreExclusive).count());
      }
      return entry;
    });
    return count.get();
  }

  @Override
  public void expire(String key, Duration ttl) {
    entries.computeIfPresent(key, (k, existing) -> {
      Entry entry = live(existing);
      if (entry != null) {
        entry.expiresAt = clock.instant().plus(ttl);
      }
      return entry;
    });
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = entries.computeIfPresent(key, (k, existing) -> live(existing));
    return entry == null ? Optional.empty() : Optional.ofNullable(entry.value);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, null, clock.instant().plus(ttl)));
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  @Override
  public void ping() {
    // always reachable
  }

  private Entry live(Entry entry) {
    if (entry == null) {
      return null;
    }
    if (entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
      return null;
    }
    return entry;
  }
}
