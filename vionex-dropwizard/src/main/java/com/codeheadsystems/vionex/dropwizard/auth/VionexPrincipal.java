package com.codeheadsystems.vionex.dropwizard.auth;

import com.codeheadsystems.vionex.server.auth.Claims;
import com.codeheadsystems.vionex.server.auth.Role;
import java.security.Principal;

/**
 * Principal representing a caller authenticated by a Vionex access token.
 *
 * @param userId   account identifier from the token subject
 * @param username account username
 * @param role     account role at the time the token was issued
 * @param tokenId  JWT ID of the presented token
 */
public record VionexPrincipal(String userId, String username, Role role, String tokenId) implements Principal {

  public static VionexPrincipal fromClaims(Claims claims) {
    return new VionexPrincipal(claims.subject(), claims.username(), claims.role(), claims.tokenId());
  }

  @Override
  public String getName() {
    return username;
  }
}
