package com.codeheadsystems.vionex.server.store;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AccountStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Usernames and emails are compared case-insensitively. All accounts are lost on server
 * restart. Suitable for development and integration testing only.
 */
public class InMemoryAccountStore implements AccountStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountStore.class);

  private final ConcurrentHashMap<String, Account> byId = new ConcurrentHashMap<>();
  // Lower-cased username and email -> id. Both names share one namespace.
  private final ConcurrentHashMap<String, String> byName = new ConcurrentHashMap<>();

  public InMemoryAccountStore() {
    log.warn("Using InMemoryAccountStore - accounts will NOT survive restarts. "
        + "Replace with a persistent AccountStore for production.");
  }

  @Override
  public Optional<Account> findByUsernameOrEmail(String identifier) {
    if (identifier == null) {
      return Optional.empty();
    }
    String id = byName.get(normalize(identifier));
    return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<Account> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public synchronized boolean create(Account account) {
    String username = normalize(account.username());
    String email = normalize(account.email());
    if (byName.containsKey(username) || byName.containsKey(email) || byId.containsKey(account.id())) {
      return false;
    }
    byId.put(account.id(), account);
    byName.put(username, account.id());
    byName.put(email, account.id());
    log.debug("Stored account id={}", account.id());
    return true;
  }

  @Override
  public void recordLogin(String id, Instant when) {
    byId.computeIfPresent(id, (k, account) -> account.withLastLogin(when));
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
