package com.codeheadsystems.vionex.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vionex.server.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

  private MutableClock clock;
  private InMemoryKeyValueStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    store = new InMemoryKeyValueStore(clock);
  }

  @Test
  void setAndGet_untilTtlElapses() {
    store.set("session:u1", "token", Duration.ofSeconds(10));
    assertThat(store.get("session:u1")).contains("token");

    clock.advance(Duration.ofSeconds(10));
    assertThat(store.get("session:u1")).isEmpty();
  }

  @Test
  void set_overwritesValueAndTtl() {
    store.set("k", "first", Duration.ofSeconds(5));
    store.set("k", "second", Duration.ofSeconds(60));
    clock.advance(Duration.ofSeconds(30));

    assertThat(store.get("k")).contains("second");
  }

  @Test
  void delete_missingKey_isNoOp() {
    assertThatCode(() -> store.delete("missing")).doesNotThrowAnyException();
  }

  @Test
  void sortedSet_countAndRemoveByScore() {
    store.sortedSetAdd("z", 100, "a");
    store.sortedSetAdd("z", 200, "b");
    store.sortedSetAdd("z", 300, "c");

    assertThat(store.sortedSetCountAbove("z", 100)).isEqualTo(2);
    assertThat(store.sortedSetRemoveUpTo("z", 200)).isEqualTo(2);
    assertThat(store.sortedSetCountAbove("z", 0)).isEqualTo(1);
  }

  @Test
  void sortedSet_sameMemberIsUpdatedNotDuplicated() {
    store.sortedSetAdd("z", 100, "a");
    store.sortedSetAdd("z", 500, "a");

    assertThat(store.sortedSetCountAbove("z", 0)).isEqualTo(1);
    assertThat(store.sortedSetCountAbove("z", 100)).isEqualTo(1);
  }

  @Test
  void sortedSet_emptiedSetIsDeleted() {
    store.sortedSetAdd("z", 100, "a");
    store.sortedSetRemoveUpTo("z", 100);
    store.expire("z", Duration.ofSeconds(5));

    // expire on a missing key is a no-op, so a new set starts without a ttl
    store.sortedSetAdd("z", 200, "b");
    clock.advance(Duration.ofHours(1));
    assertThat(store.sortedSetCountAbove("z", 0)).isEqualTo(1);
  }

  @Test
  void expire_appliesToSortedSets() {
    store.sortedSetAdd("z", 100, "a");
    store.expire("z", Duration.ofSeconds(60));

    clock.advance(Duration.ofSeconds(59));
    assertThat(store.sortedSetCountAbove("z", 0)).isEqualTo(1);
    clock.advance(Duration.ofSeconds(1));
    assertThat(store.sortedSetCountAbove("z", 0)).isZero();
  }

  @Test
  void sortedSetAdd_onPlainValue_isRejected() {
    store.set("k", "v", Duration.ofSeconds(60));

    assertThatThrownBy(() -> store.sortedSetAdd("k", 1, "m")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void ping_succeeds() {
    assertThatCode(store::ping).doesNotThrowAnyException();
  }
}
