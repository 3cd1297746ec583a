package com.codeheadsystems.vionex.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.Verification;
import com.codeheadsystems.vionex.server.error.AuthError;
import com.codeheadsystems.vionex.server.error.AuthResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies HMAC-SHA256 signed JWTs carrying {@link Claims}.
 * <p>
 * Access and refresh tokens share the claim shape and the verification path; only their
 * lifetime differs. Verification is self-contained and needs no store round-trip.
 * <p>
 * Expiry is exclusive: a token issued with lifetime {@code T} at {@code t0} verifies for
 * {@code [t0, t0 + T)} and is {@link AuthError#TOKEN_EXPIRED} from {@code t0 + T} on.
 * <p>
 * The registered {@code iat} and {@code exp} claims only hold whole seconds, so the exact instants
 * travel in the {@value #ISSUED_AT_MILLIS_CLAIM} and {@value #EXPIRES_AT_MILLIS_CLAIM} claims.
 * {@code exp} is rounded up to the next whole second.
 */
public class TokenManager {

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  static final String USERNAME_CLAIM = "username";
  static final String ROLE_CLAIM = "role";
  static final String ISSUED_AT_MILLIS_CLAIM = "iat_ms";
  static final String EXPIRES_AT_MILLIS_CLAIM = "exp_ms";

  private static final Duration MIN_TTL = Duration.ofSeconds(1);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Clock clock;

  /**
   * Creates a new TokenManager.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer JWT issuer claim, required on verification
   * @param clock  time source for issuance and expiry checks
   */
  public TokenManager(byte[] secret, String issuer, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    Verification verification = JWT.require(algorithm).withIssuer(issuer);
    // build(Clock) exists only on java-jwt's concrete BaseVerification.
    this.verifier = ((JWTVerifier.BaseVerification) verification).build(clock);
    this.issuer = issuer;
    this.clock = clock;
  }

  /**
   * Signs a token valid from now for {@code ttl}, both at millisecond precision.
   *
   * @throws IllegalArgumentException if {@code ttl} is shorter than one second
   */
  public IssuedToken issue(ClaimsInput input, Duration ttl) {
    if (ttl.compareTo(MIN_TTL) < 0) {
      throw new IllegalArgumentException("ttl must be at least one second: " + ttl);
    }
    Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Instant expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.MILLIS);
    String jti = UUID.randomUUID().toString();

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(input.subject())
        .withClaim(USERNAME_CLAIM, input.username())
        .withClaim(ROLE_CLAIM, input.role().claimValue())
        .withIssuedAt(issuedAt)
        .withExpiresAt(roundUpToSecond(expiresAt))
        .withClaim(ISSUED_AT_MILLIS_CLAIM, issuedAt.toEpochMilli())
        .withClaim(EXPIRES_AT_MILLIS_CLAIM, expiresAt.toEpochMilli())
        .sign(algorithm);

    log.debug("Issued token jti={} for subject {} expiring {}", jti, input.subject(), expiresAt);
    return new IssuedToken(token, new Claims(jti, input.subject(), input.username(), input.role(),
        issuedAt, expiresAt));
  }

  /**
   * Verifies signature, issuer and expiry and returns the embedded claims.
   *
   * @return the claims, {@link AuthError#TOKEN_EXPIRED} or {@link AuthError#TOKEN_MALFORMED}
   */
  public AuthResult<Claims> verify(String token) {
    if (token == null || token.isBlank()) {
      return AuthResult.failure(AuthError.TOKEN_MALFORMED);
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (TokenExpiredException e) {
      log.debug("Token expired at {}", e.getExpiredOn());
      return AuthResult.failure(AuthError.TOKEN_EXPIRED);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return AuthResult.failure(AuthError.TOKEN_MALFORMED);
    }

    String username = decoded.getClaim(USERNAME_CLAIM).asString();
    Optional<Role> role = Role.fromClaim(decoded.getClaim(ROLE_CLAIM).asString());
    Long issuedAtMillis = decoded.getClaim(ISSUED_AT_MILLIS_CLAIM).asLong();
    Long expiresAtMillis = decoded.getClaim(EXPIRES_AT_MILLIS_CLAIM).asLong();
    if (decoded.getId() == null || decoded.getSubject() == null || username == null
        || role.isEmpty() || issuedAtMillis == null || expiresAtMillis == null) {
      log.debug("Token jti={} is missing required claims", decoded.getId());
      return AuthResult.failure(AuthError.TOKEN_MALFORMED);
    }
    Instant issuedAt = Instant.ofEpochMilli(issuedAtMillis);
    Instant expiresAt = Instant.ofEpochMilli(expiresAtMillis);
    if (!clock.instant().isBefore(expiresAt)) {
      return AuthResult.failure(AuthError.TOKEN_EXPIRED);
    }
    return AuthResult.success(new Claims(decoded.getId(), decoded.getSubject(), username, role.get(),
        issuedAt, expiresAt));
  }

  private static Instant roundUpToSecond(Instant instant) {
    Instant truncated = instant.truncatedTo(ChronoUnit.SECONDS);
    return truncated.equals(instant) ? instant : truncated.plusSeconds(1);
  }
}
