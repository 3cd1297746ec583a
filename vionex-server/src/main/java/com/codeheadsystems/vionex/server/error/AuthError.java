package com.codeheadsystems.vionex.server.error;

/**
 * Security decisions reported by the authentication core.
 * <p>
 * These are expected outcomes, not faults, and are returned inside an {@link AuthResult}
 * rather than thrown. Infrastructure faults use {@link AuthInfrastructureException} instead.
 * <p>
 * {@link #ACCOUNT_NOT_FOUND} is internal only. Callers rendering an error to a client must
 * use {@link #publicError()} so an unknown account is indistinguishable from a bad password.
 */
public enum AuthError {

  INVALID_CREDENTIALS(401, "Invalid username or password"),
  ACCOUNT_NOT_FOUND(401, "Invalid username or password"),
  TOO_MANY_ATTEMPTS(429, "Too many login attempts. Please try again later"),
  TOKEN_EXPIRED(401, "Token has expired"),
  TOKEN_MALFORMED(401, "Invalid token"),
  SESSION_INVALID(401, "Session is no longer valid"),
  INVALID_REQUEST(400, "Invalid request"),
  ACCOUNT_EXISTS(409, "Username or email already exists");

  private final int httpStatus;
  private final String message;

  AuthError(int httpStatus, String message) {
    this.httpStatus = httpStatus;
    this.message = message;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public String message() {
    return message;
  }

  /**
   * Returns the error as it may be shown to a client.
   *
   * @return {@link #INVALID_CREDENTIALS} for {@link #ACCOUNT_NOT_FOUND}, otherwise this error
   */
  public AuthError publicError() {
    return this == ACCOUNT_NOT_FOUND ? INVALID_CREDENTIALS : this;
  }
}
