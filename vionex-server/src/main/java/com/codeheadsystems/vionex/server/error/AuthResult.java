package com.codeheadsystems.vionex.server.error;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a security decision: either a value or an {@link AuthError}, never both.
 *
 * @param value the successful value, null on failure
 * @param error the failure, null on success
 * @param <T>   type of the successful value
 */
public record AuthResult<T>(T value, AuthError error) {

  public AuthResult {
    if ((value == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of value or error must be set");
    }
  }

  public static <T> AuthResult<T> success(T value) {
    return new AuthResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> AuthResult<T> failure(AuthError error) {
    return new AuthResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public boolean isFailure() {
    return error != null;
  }

  /**
   * @return the value if successful, empty otherwise
   */
  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  /**
   * Re-types a failure so it can be returned from a method with a different value type.
   *
   * @throws IllegalStateException if this result is a success
   */
  public <U> AuthResult<U> propagate() {
    if (isSuccess()) {
      throw new IllegalStateException("Cannot propagate a successful result");
    }
    return failure(error);
  }
}
