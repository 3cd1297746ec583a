package com.codeheadsystems.vionex.server.store;

import com.codeheadsystems.vionex.server.auth.Role;
import java.time.Instant;
import java.util.Objects;

/**
 * An account as known to the authentication core.
 *
 * @param id           stable identifier, used as the token subject and session key
 * @param username     unique username
 * @param email        unique email address
 * @param passwordHash bcrypt modular crypt string
 * @param role         platform role
 * @param active       inactive accounts cannot log in
 * @param lastLogin    time of the most recent successful login, null if never
 */
public record Account(
    String id,
    String username,
    String email,
    String passwordHash,
    Role role,
    boolean active,
    Instant lastLogin) {

  public Account {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(passwordHash, "passwordHash");
    Objects.requireNonNull(role, "role");
  }

  public Account withLastLogin(Instant when) {
    return new Account(id, username, email, passwordHash, role, active, when);
  }

  @Override
  public String toString() {
    return "Account[id=" + id + ", username=" + username + ", role=" + role + ", active=" + active + "]";
  }
}
