package com.codeheadsystems.vionex.server.error;

/**
 * The password hashing library failed, or a stored hash could not be parsed.
 */
public class HashingFailedException extends AuthInfrastructureException {

  public HashingFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int httpStatus() {
    return 500;
  }
}
