package com.codeheadsystems.vionex.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for accounts, owned by the user-management side of the platform.
 * <p>
 * Implementations must be thread-safe. Username and email are each unique.
 */
public interface AccountStore {

  /**
   * Finds an account whose username or email equals {@code identifier}.
   *
   * @param identifier username or email address
   * @return the account, active or not, or empty if none matches
   */
  Optional<Account> findByUsernameOrEmail(String identifier);

  Optional<Account> findById(String id);

  /**
   * Stores a new account.
   *
   * @return true if stored, false if the username or email is already taken
   */
  boolean create(Account account);

  /**
   * Records the time of a successful login. No-op if the account no longer exists.
   */
  void recordLogin(String id, Instant when);
}
