package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of an account, safe to return to its owner.
 *
 * @param id       stable account identifier
 * @param username account username
 * @param email    account email address, may be null when not disclosed
 * @param role     lower-case role name, e.g. {@code viewer}
 */
public record UserSummary(
    @JsonProperty("id") String id,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("role") String role) {
}
