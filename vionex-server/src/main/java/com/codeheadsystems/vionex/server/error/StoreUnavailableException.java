package com.codeheadsystems.vionex.server.error;

/**
 * The shared key/value store could not be reached, timed out, or rejected a command.
 */
public class StoreUnavailableException extends AuthInfrastructureException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int httpStatus() {
    return 503;
  }
}
