package com.codeheadsystems.vionex.server.auth;

/**
 * A freshly signed token together with the claims it carries.
 *
 * @param token  compact JWT string
 * @param claims the claims signed into {@code token}
 */
public record IssuedToken(String token, Claims claims) {

  @Override
  public String toString() {
    return "IssuedToken[claims=" + claims + "]";
  }
}
