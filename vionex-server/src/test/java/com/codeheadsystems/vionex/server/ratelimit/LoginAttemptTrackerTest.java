package com.codeheadsystems.vionex.server.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.vionex.server.MutableClock;
import com.codeheadsystems.vionex.server.config.WindowConfig;
import com.codeheadsystems.vionex.server.store.InMemoryKeyValueStore;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoginAttemptTrackerTest {

  private static final int MAX_ATTEMPTS = 5;
  private static final Duration WINDOW = Duration.ofMinutes(15);

  private MutableClock clock;
  private InMemoryKeyValueStore store;
  private LoginAttemptTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    store = new InMemoryKeyValueStore(clock);
    tracker = new LoginAttemptTracker(new SlidingWindowCounter(store),
        new WindowConfig(MAX_ATTEMPTS, WINDOW), clock);
  }

  private void fail(int times) {
    for (int i = 0; i < times; i++) {
      tracker.recordAttempt("acct-1", false);
      clock.advance(Duration.ofSeconds(1));
    }
  }

  @Test
  void blocksAtThreshold() {
    fail(MAX_ATTEMPTS - 1);
    assertThat(tracker.isBlocked("acct-1")).isFalse();

    fail(1);
    assertThat(tracker.isBlocked("acct-1")).isTrue();
  }

  @Test
  void success_clearsHistory() {
    fail(MAX_ATTEMPTS);

    tracker.recordAttempt("acct-1", true);

    assertThat(tracker.isBlocked("acct-1")).isFalse();
    assertThat(store.get("login_attempts:acct-1")).isEmpty();
    // History is gone, not decremented: four more failures do not block
    fail(MAX_ATTEMPTS - 1);
    assertThat(tracker.isBlocked("acct-1")).isFalse();
  }

  @Test
  void unblocksOnceFailuresAgeOut() {
    fail(MAX_ATTEMPTS);
    assertThat(tracker.isBlocked("acct-1")).isTrue();

    clock.advance(WINDOW);

    assertThat(tracker.isBlocked("acct-1")).isFalse();
  }

  @Test
  void isBlocked_doesNotRecord() {
    fail(MAX_ATTEMPTS - 1);
    for (int i = 0; i < 10; i++) {
      tracker.isBlocked("acct-1");
    }

    assertThat(tracker.isBlocked("acct-1")).isFalse();
  }

  @Test
  void accountsAreIndependent() {
    fail(MAX_ATTEMPTS);

    assertThat(tracker.isBlocked("acct-1")).isTrue();
    assertThat(tracker.isBlocked("acct-2")).isFalse();
  }
}
