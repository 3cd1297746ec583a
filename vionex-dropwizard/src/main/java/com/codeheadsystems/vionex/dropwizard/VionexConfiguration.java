package com.codeheadsystems.vionex.dropwizard;

import com.codeheadsystems.vionex.server.config.AuthConfig;
import com.codeheadsystems.vionex.server.config.WindowConfig;
import com.codeheadsystems.vionex.server.resource.RateLimitFilter;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;

/**
 * Dropwizard configuration for the Vionex auth endpoints.
 * <p>
 * For production, supply {@code jwtSecretHex} (at least 32 bytes, hex encoded) so tokens survive
 * restarts and are accepted by every instance, and {@code redisUri} so sessions, lockouts and rate
 * windows are shared. Omitting either falls back to per-process state (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class VionexConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for JWT tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  @NotEmpty
  private String jwtIssuer = AuthConfig.DEFAULT_ISSUER;

  @Min(1)
  private long accessTokenTtlSeconds = AuthConfig.DEFAULT_ACCESS_TOKEN_TTL.getSeconds();

  @Min(1)
  private long refreshTokenTtlSeconds = AuthConfig.DEFAULT_REFRESH_TOKEN_TTL.getSeconds();

  /**
   * bcrypt work factor for new password hashes.
   */
  @Min(4)
  @Max(31)
  private int bcryptCost = AuthConfig.DEFAULT_BCRYPT_COST;

  @Min(1)
  private int maxLoginAttempts = AuthConfig.DEFAULT_LOGIN_ATTEMPTS.maxEvents();

  @Min(1)
  private long loginAttemptWindowSeconds = AuthConfig.DEFAULT_LOGIN_ATTEMPTS.window().getSeconds();

  /**
   * Requests admitted per client and path within {@code rateLimitWindowSeconds}.
   */
  @Min(1)
  private int rateLimitRequests = AuthConfig.DEFAULT_RATE_LIMIT.maxEvents();

  @Min(1)
  private long rateLimitWindowSeconds = AuthConfig.DEFAULT_RATE_LIMIT.window().getSeconds();

  /**
   * Proxies in front of the service that append to {@code X-Forwarded-For}. The client address
   * is the entry this many positions from the right; 0 ignores the header.
   */
  @Min(0)
  private int rateLimitTrustedProxies = RateLimitFilter.DEFAULT_TRUSTED_PROXIES;

  /**
   * When true, every refresh replaces the refresh token and the old one stops working.
   */
  private boolean rotateRefreshTokens = false;

  /**
   * Redis URI, e.g. {@code redis://localhost:6379/0}.
   * Leave empty for an in-memory store (dev only, not shared between instances).
   */
  private String redisUri = "";

  /**
   * Upper bound on every Redis command; a timeout fails the request closed.
   */
  @Min(1)
  private long redisCommandTimeoutMillis = 2000;

  /**
   * Builds the immutable core configuration.
   *
   * @param secret the signing secret to use
   * @return the auth config
   */
  public AuthConfig toAuthConfig(byte[] secret) {
    return new AuthConfig(
        jwtIssuer,
        secret,
        Duration.ofSeconds(accessTokenTtlSeconds),
        Duration.ofSeconds(refreshTokenTtlSeconds),
        bcryptCost,
        new WindowConfig(maxLoginAttempts, Duration.ofSeconds(loginAttemptWindowSeconds)),
        new WindowConfig(rateLimitRequests, Duration.ofSeconds(rateLimitWindowSeconds)),
        rotateRefreshTokens);
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  @JsonProperty
  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  @JsonProperty
  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  @JsonProperty
  public int getMaxLoginAttempts() {
    return maxLoginAttempts;
  }

  @JsonProperty
  public void setMaxLoginAttempts(int maxLoginAttempts) {
    this.maxLoginAttempts = maxLoginAttempts;
  }

  @JsonProperty
  public long getLoginAttemptWindowSeconds() {
    return loginAttemptWindowSeconds;
  }

  @JsonProperty
  public void setLoginAttemptWindowSeconds(long loginAttemptWindowSeconds) {
    this.loginAttemptWindowSeconds = loginAttemptWindowSeconds;
  }

  @JsonProperty
  public int getRateLimitRequests() {
    return rateLimitRequests;
  }

  @JsonProperty
  public void setRateLimitRequests(int rateLimitRequests) {
    this.rateLimitRequests = rateLimitRequests;
  }

  @JsonProperty
  public long getRateLimitWindowSeconds() {
    return rateLimitWindowSeconds;
  }

  @JsonProperty
  public void setRateLimitWindowSeconds(long rateLimitWindowSeconds) {
    this.rateLimitWindowSeconds = rateLimitWindowSeconds;
  }

  @JsonProperty
  public int getRateLimitTrustedProxies() {
    return rateLimitTrustedProxies;
  }

  @JsonProperty
  public void setRateLimitTrustedProxies(int rateLimitTrustedProxies) {
    this.rateLimitTrustedProxies = rateLimitTrustedProxies;
  }

  @JsonProperty
  public boolean isRotateRefreshTokens() {
    return rotateRefreshTokens;
  }

  @JsonProperty
  public void setRotateRefreshTokens(boolean rotateRefreshTokens) {
    this.rotateRefreshTokens = rotateRefreshTokens;
  }

  /**
   * Gets redis uri.
   *
   * @return the redis uri, empty for the in-memory store
   */
  @JsonProperty
  public String getRedisUri() {
    return redisUri;
  }

  /**
   * Sets redis uri.
   *
   * @param redisUri the redis uri
   */
  @JsonProperty
  public void setRedisUri(String redisUri) {
    this.redisUri = redisUri;
  }

  @JsonProperty
  public long getRedisCommandTimeoutMillis() {
    return redisCommandTimeoutMillis;
  }

  @JsonProperty
  public void setRedisCommandTimeoutMillis(long redisCommandTimeoutMillis) {
    this.redisCommandTimeoutMillis = redisCommandTimeoutMillis;
  }
}
