package com.codeheadsystems.vionex.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.vionex.server.MutableClock;
import com.codeheadsystems.vionex.server.error.AuthError;
import com.codeheadsystems.vionex.server.error.AuthResult;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenManagerTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);
  private static final ClaimsInput ALICE = new ClaimsInput("user-1", "alice", Role.CREATOR);
  private static final Duration TTL = Duration.ofHours(1);

  private MutableClock clock;
  private TokenManager tokenManager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T10:00:00.750Z"));
    tokenManager = new TokenManager(SECRET, "test-issuer", clock);
  }

  @Test
  void issueAndVerify_roundTripReturnsIdenticalClaims() {
    IssuedToken issued = tokenManager.issue(ALICE, TTL);

    AuthResult<Claims> result = tokenManager.verify(issued.token());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(issued.claims());
    assertThat(result.value().subject()).isEqualTo("user-1");
    assertThat(result.value().username()).isEqualTo("alice");
    assertThat(result.value().role()).isEqualTo(Role.CREATOR);
  }

  @Test
  void issue_keepsMillisecondPrecision() {
    Claims claims = tokenManager.issue(ALICE, TTL).claims();

    assertThat(claims.issuedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00.750Z"));
    assertThat(claims.expiresAt()).isEqualTo(Instant.parse("2026-03-01T11:00:00.750Z"));
  }

  @Test
  void verify_lateInTheIssuingSecond_staysValidForTheFullLifetime() {
    clock.set(Instant.parse("2026-03-01T10:00:00.900Z"));
    IssuedToken issued = tokenManager.issue(ALICE, Duration.ofSeconds(10));

    clock.advance(Duration.ofMillis(9_500));
    AuthResult<Claims> result = tokenManager.verify(issued.token());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(issued.claims());

    clock.set(Instant.parse("2026-03-01T10:00:10.900Z"));
    assertThat(tokenManager.verify(issued.token()).error()).isEqualTo(AuthError.TOKEN_EXPIRED);
  }

  @Test
  void issue_keepsSubSecondPartOfTtl() {
    IssuedToken issued = tokenManager.issue(ALICE, Duration.ofMillis(1_500));

    assertThat(issued.claims().expiresAt()).isEqualTo(Instant.parse("2026-03-01T10:00:02.250Z"));
    clock.advance(Duration.ofMillis(1_499));
    assertThat(tokenManager.verify(issued.token()).isSuccess()).isTrue();
    clock.advance(Duration.ofMillis(1));
    assertThat(tokenManager.verify(issued.token()).error()).isEqualTo(AuthError.TOKEN_EXPIRED);
  }

  @Test
  void issue_registeredExpClaimIsRoundedUp() {
    IssuedToken issued = tokenManager.issue(ALICE, TTL);

    assertThat(JWT.decode(issued.token()).getExpiresAtAsInstant())
        .isEqualTo(Instant.parse("2026-03-01T11:00:01Z"));
    assertThat(JWT.decode(issued.token()).getIssuedAtAsInstant())
        .isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
  }

  @Test
  void issue_sameSecondTokensDiffer() {
    String first = tokenManager.issue(ALICE, TTL).token();
    String second = tokenManager.issue(ALICE, TTL).token();

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void verify_lastSecondBeforeExpiry_succeeds() {
    IssuedToken issued = tokenManager.issue(ALICE, TTL);
    clock.set(issued.claims().expiresAt().minusMillis(1));

    assertThat(tokenManager.verify(issued.token()).isSuccess()).isTrue();
  }

  @Test
  void verify_atExpiry_returnsExpired() {
    IssuedToken issued = tokenManager.issue(ALICE, TTL);
    clock.set(issued.claims().expiresAt());

    assertThat(tokenManager.verify(issued.token()).error()).isEqualTo(AuthError.TOKEN_EXPIRED);
  }

  @Test
  void verify_longAfterExpiry_returnsExpired() {
    IssuedToken issued = tokenManager.issue(ALICE, TTL);
    clock.advance(Duration.ofDays(3));

    assertThat(tokenManager.verify(issued.token()).error()).isEqualTo(AuthError.TOKEN_EXPIRED);
  }

  @Test
  void verify_wrongSecret_returnsMalformed() {
    String token = tokenManager.issue(ALICE, TTL).token();
    TokenManager other = new TokenManager(WRONG_SECRET, "test-issuer", clock);

    assertThat(other.verify(token).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_wrongIssuer_returnsMalformed() {
    String token = tokenManager.issue(ALICE, TTL).token();
    TokenManager other = new TokenManager(SECRET, "someone-else", clock);

    assertThat(other.verify(token).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_tamperedToken_returnsMalformed() {
    String token = tokenManager.issue(ALICE, TTL).token();
    // Flip a character in the signature part
    String tampered = token.substring(0, token.length() - 2) + (token.endsWith("XX") ? "YY" : "XX");

    assertThat(tokenManager.verify(tampered).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_garbage_returnsMalformed() {
    assertThat(tokenManager.verify("not-a-jwt").error()).isEqualTo(AuthError.TOKEN_MALFORMED);
    assertThat(tokenManager.verify("").error()).isEqualTo(AuthError.TOKEN_MALFORMED);
    assertThat(tokenManager.verify(null).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_unknownRole_returnsMalformed() {
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("jti-1")
        .withSubject("user-1")
        .withClaim(TokenManager.USERNAME_CLAIM, "alice")
        .withClaim(TokenManager.ROLE_CLAIM, "superuser")
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(60))
        .withClaim(TokenManager.ISSUED_AT_MILLIS_CLAIM, now.toEpochMilli())
        .withClaim(TokenManager.EXPIRES_AT_MILLIS_CLAIM, now.plusSeconds(60).toEpochMilli())
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenManager.verify(token).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_missingUsername_returnsMalformed() {
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("jti-2")
        .withSubject("user-1")
        .withClaim(TokenManager.ROLE_CLAIM, "viewer")
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(60))
        .withClaim(TokenManager.ISSUED_AT_MILLIS_CLAIM, now.toEpochMilli())
        .withClaim(TokenManager.EXPIRES_AT_MILLIS_CLAIM, now.plusSeconds(60).toEpochMilli())
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenManager.verify(token).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_noneAlgorithm_returnsMalformed() {
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("jti-3")
        .withSubject("user-1")
        .withClaim(TokenManager.USERNAME_CLAIM, "alice")
        .withClaim(TokenManager.ROLE_CLAIM, "admin")
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(60))
        .withClaim(TokenManager.ISSUED_AT_MILLIS_CLAIM, now.toEpochMilli())
        .withClaim(TokenManager.EXPIRES_AT_MILLIS_CLAIM, now.plusSeconds(60).toEpochMilli())
        .sign(Algorithm.none());

    assertThat(tokenManager.verify(token).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }

  @Test
  void verify_missingMillisecondExpiry_returnsMalformed() {
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("jti-4")
        .withSubject("user-1")
        .withClaim(TokenManager.USERNAME_CLAIM, "alice")
        .withClaim(TokenManager.ROLE_CLAIM, "viewer")
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(60))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenManager.verify(token).error()).isEqualTo(AuthError.TOKEN_MALFORMED);
  }
}
