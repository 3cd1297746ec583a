package com.codeheadsystems.vionex.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.vionex.server.auth.Claims;
import com.codeheadsystems.vionex.server.auth.Role;
import com.codeheadsystems.vionex.server.error.AuthError;
import com.codeheadsystems.vionex.server.error.AuthResult;
import com.codeheadsystems.vionex.server.manager.AuthenticationManager;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VionexAuthenticatorTest {

  @Mock private AuthenticationManager authenticationManager;

  private VionexAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    authenticator = new VionexAuthenticator(authenticationManager);
  }

  @Test
  void validToken_yieldsPrincipal() throws Exception {
    Instant now = Instant.ofEpochSecond(1_700_000_000L);
    Claims claims = new Claims("jti-1", "user-1", "alice", Role.CREATOR, now, now.plusSeconds(60));
    when(authenticationManager.authenticate("token")).thenReturn(AuthResult.success(claims));

    assertThat(authenticator.authenticate("token"))
        .contains(new VionexPrincipal("user-1", "alice", Role.CREATOR, "jti-1"));
    assertThat(authenticator.authenticate("token").orElseThrow().getName()).isEqualTo("alice");
  }

  @Test
  void expiredToken_yieldsEmpty() throws Exception {
    when(authenticationManager.authenticate("expired")).thenReturn(AuthResult.failure(AuthError.TOKEN_EXPIRED));

    assertThat(authenticator.authenticate("expired")).isEmpty();
  }
}
