package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic error body. Messages are user-facing and never carry internal detail.
 *
 * @param success always {@code false}
 * @param message user-facing description of the failure
 */
public record ErrorResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message) {

  public static ErrorResponse of(String message) {
    return new ErrorResponse(false, message);
  }
}
