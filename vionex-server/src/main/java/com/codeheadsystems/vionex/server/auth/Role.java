package com.codeheadsystems.vionex.server.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * Platform roles, carried in the {@code role} claim of every token.
 */
public enum Role {
  VIEWER,
  CREATOR,
  BRAND,
  ADVERTISER,
  MODERATOR,
  ADMIN;

  /**
   * @return the lower-case form used in token claims and JSON
   */
  public String claimValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a claim value case-insensitively.
   *
   * @return the role, or empty if the value is null or unknown
   */
  public static Optional<Role> fromClaim(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (Role role : values()) {
      if (role.name().equalsIgnoreCase(value)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
