package com.codeheadsystems.vionex.server.error;

/**
 * Base class for faults in the systems the authentication core depends on.
 * <p>
 * These always propagate to the caller. They must never be interpreted as a security
 * decision: a store that cannot be reached does not mean "no session" or "not blocked".
 */
public abstract class AuthInfrastructureException extends RuntimeException {

  protected AuthInfrastructureException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the HTTP status an adapter should answer with
   */
  public abstract int httpStatus();
}
