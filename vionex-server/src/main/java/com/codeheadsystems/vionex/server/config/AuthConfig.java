package com.codeheadsystems.vionex.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for the authentication core, built once at startup.
 *
 * @param issuer              JWT issuer claim
 * @param secret              HMAC-SHA256 signing secret, at least 32 bytes
 * @param accessTokenTtl      lifetime of access tokens
 * @param refreshTokenTtl     lifetime of refresh tokens and their sessions
 * @param bcryptCost          bcrypt work factor, 4 to 31
 * @param loginAttempts       failed-login lockout window
 * @param rateLimit           per-caller request rate limit
 * @param rotateRefreshTokens whether {@code refresh} replaces the refresh token
 */
public record AuthConfig(
    String issuer,
    byte[] secret,
    Duration accessTokenTtl,
    Duration refreshTokenTtl,
    int bcryptCost,
    WindowConfig loginAttempts,
    WindowConfig rateLimit,
    boolean rotateRefreshTokens) {

  public static final String DEFAULT_ISSUER = "vionex";
  public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofHours(24);
  public static final Duration DEFAULT_REFRESH_TOKEN_TTL = Duration.ofDays(7);
  public static final int DEFAULT_BCRYPT_COST = 12;
  public static final WindowConfig DEFAULT_LOGIN_ATTEMPTS = new WindowConfig(5, Duration.ofMinutes(15));
  public static final WindowConfig DEFAULT_RATE_LIMIT = new WindowConfig(60, Duration.ofMinutes(1));

  private static final int MIN_SECRET_BYTES = 32;

  public AuthConfig {
    Objects.requireNonNull(issuer, "issuer");
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(accessTokenTtl, "accessTokenTtl");
    Objects.requireNonNull(refreshTokenTtl, "refreshTokenTtl");
    Objects.requireNonNull(loginAttempts, "loginAttempts");
    Objects.requireNonNull(rateLimit, "rateLimit");
    if (secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException("secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (accessTokenTtl.getSeconds() < 1 || refreshTokenTtl.getSeconds() < 1) {
      throw new IllegalArgumentException("token lifetimes must be at least one second");
    }
    secret = secret.clone();
  }

  /**
   * Configuration with the platform defaults and the given signing secret.
   */
  public static AuthConfig withDefaults(byte[] secret) {
    return new AuthConfig(DEFAULT_ISSUER, secret, DEFAULT_ACCESS_TOKEN_TTL, DEFAULT_REFRESH_TOKEN_TTL,
        DEFAULT_BCRYPT_COST, DEFAULT_LOGIN_ATTEMPTS, DEFAULT_RATE_LIMIT, false);
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  @Override
  public String toString() {
    return "AuthConfig[issuer=" + issuer
        + ", accessTokenTtl=" + accessTokenTtl
        + ", refreshTokenTtl=" + refreshTokenTtl
        + ", bcryptCost=" + bcryptCost
        + ", loginAttempts=" + loginAttempts
        + ", rateLimit=" + rateLimit
        + ", rotateRefreshTokens=" + rotateRefreshTokens + "]";
  }
}
