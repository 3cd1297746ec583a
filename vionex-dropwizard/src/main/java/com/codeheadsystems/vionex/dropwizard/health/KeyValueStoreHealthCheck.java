package com.codeheadsystems.vionex.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.vionex.server.error.StoreUnavailableException;
import com.codeheadsystems.vionex.server.store.KeyValueStore;

/**
 * Health check that round-trips to the shared key/value store.
 * Logins, refreshes and rate-limited requests all fail closed while it is unhealthy.
 */
public class KeyValueStoreHealthCheck extends HealthCheck {

  private final KeyValueStore store;

  /**
   * Instantiates a new key/value store health check.
   *
   * @param store the store
   */
  public KeyValueStoreHealthCheck(KeyValueStore store) {
    this.store = store;
  }

  @Override
  protected Result check() {
    try {
      store.ping();
    } catch (StoreUnavailableException e) {
      return Result.unhealthy("Key/value store unavailable: %s", e.getMessage());
    }
    return Result.healthy("store=%s", store.getClass().getSimpleName());
  }
}
