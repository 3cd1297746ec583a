package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plain acknowledgement body.
 *
 * @param success always {@code true}
 * @param message human-readable acknowledgement
 */
public record MessageResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message) {

  public static MessageResponse ok(String message) {
    return new MessageResponse(true, message);
  }
}
