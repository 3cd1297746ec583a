package com.codeheadsystems.vionex.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Limit of {@code maxEvents} events within any trailing {@code window}.
 * Used for both login-attempt lockout and request rate limiting.
 *
 * @param maxEvents maximum events admitted in the window, at least 1
 * @param window    length of the trailing window, positive
 */
public record WindowConfig(int maxEvents, Duration window) {

  public WindowConfig {
    Objects.requireNonNull(window, "window");
    if (maxEvents < 1) {
      throw new IllegalArgumentException("maxEvents must be at least 1: " + maxEvents);
    }
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
  }
}
