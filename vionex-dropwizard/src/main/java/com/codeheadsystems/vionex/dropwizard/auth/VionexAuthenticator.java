package com.codeheadsystems.vionex.dropwizard.auth;

import com.codeheadsystems.vionex.server.manager.AuthenticationManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates bearer access tokens using
 * {@link AuthenticationManager#authenticate(String)}.
 * <p>
 * Access tokens are self-contained, so no store round trip is made. Expired and malformed tokens
 * both yield an empty result, which Dropwizard answers with 401.
 */
public class VionexAuthenticator implements Authenticator<String, VionexPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(VionexAuthenticator.class);

  private final AuthenticationManager authenticationManager;

  /**
   * Instantiates a new Vionex authenticator.
   *
   * @param authenticationManager the authentication manager
   */
  public VionexAuthenticator(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  @Override
  public Optional<VionexPrincipal> authenticate(String token) throws AuthenticationException {
    var result = authenticationManager.authenticate(token);
    if (result.isFailure()) {
      log.debug("Rejected bearer token: {}", result.error());
      return Optional.empty();
    }
    return Optional.of(VionexPrincipal.fromClaims(result.value()));
  }
}
