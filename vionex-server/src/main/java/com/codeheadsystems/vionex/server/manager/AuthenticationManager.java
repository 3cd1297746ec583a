package com.codeheadsystems.vionex.server.manager;

import com.codeheadsystems.vionex.server.auth.Claims;
import com.codeheadsystems.vionex.server.auth.ClaimsInput;
import com.codeheadsystems.vionex.server.auth.IssuedToken;
import com.codeheadsystems.vionex.server.auth.PasswordHasher;
import com.codeheadsystems.vionex.server.auth.Role;
import com.codeheadsystems.vionex.server.auth.TokenManager;
import com.codeheadsystems.vionex.server.config.AuthConfig;
import com.codeheadsystems.vionex.server.error.AuthError;
import com.codeheadsystems.vionex.server.error.AuthResult;
import com.codeheadsystems.vionex.server.ratelimit.LoginAttemptTracker;
import com.codeheadsystems.vionex.server.store.Account;
import com.codeheadsystems.vionex.server.store.AccountStore;
import com.codeheadsystems.vionex.server.store.SessionStore;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic login, refresh and logout orchestration.
 * <p>
 * Framework adapters ({@code AuthResource} for JAX-RS / Dropwizard) stay thin: they translate
 * {@link AuthResult} failures into HTTP responses via {@link AuthError#publicError()}.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>Security decisions (bad password, lockout, bad token, stale session) are returned as
 *       {@link AuthResult} failures and never thrown.</li>
 *   <li>{@link com.codeheadsystems.vionex.server.error.StoreUnavailableException} and
 *       {@link com.codeheadsystems.vionex.server.error.HashingFailedException} always propagate.
 *       No operation reports success after one of them.</li>
 * </ul>
 */
public class AuthenticationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationManager.class);

  private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9_]{3,50}");
  private static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");
  private static final int MIN_PASSWORD_LENGTH = 8;
  private static final int MAX_EMAIL_LENGTH = 254;

  private final AuthConfig config;
  private final AccountStore accountStore;
  private final PasswordHasher passwordHasher;
  private final TokenManager tokenManager;
  private final LoginAttemptTracker loginAttemptTracker;
  private final SessionStore sessionStore;
  private final Clock clock;

  public AuthenticationManager(AuthConfig config,
                               AccountStore accountStore,
                               PasswordHasher passwordHasher,
                               TokenManager tokenManager,
                               LoginAttemptTracker loginAttemptTracker,
                               SessionStore sessionStore,
                               Clock clock) {
    this.config = config;
    this.accountStore = accountStore;
    this.passwordHasher = passwordHasher;
    this.tokenManager = tokenManager;
    this.loginAttemptTracker = loginAttemptTracker;
    this.sessionStore = sessionStore;
    this.clock = clock;
  }

  // ── Login ────────────────────────────────────────────────────────────────

  /**
   * Authenticates by username or email and password, opening the account's single session.
   * <p>
   * A locked-out account is rejected before its password is checked. Any earlier session of the
   * account is replaced, so its refresh token stops working.
   *
   * @return tokens on success; {@link AuthError#ACCOUNT_NOT_FOUND},
   *     {@link AuthError#TOO_MANY_ATTEMPTS} or {@link AuthError#INVALID_CREDENTIALS} otherwise
   */
  public AuthResult<LoginResult> login(String identifier, String password) {
    log.debug("login()");
    if (identifier == null || identifier.isBlank() || password == null) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    Optional<Account> found = accountStore.findByUsernameOrEmail(identifier.trim())
        .filter(Account::active);
    if (found.isEmpty()) {
      passwordHasher.equalizeTiming(password);
      return AuthResult.failure(AuthError.ACCOUNT_NOT_FOUND);
    }
    Account account = found.get();

    if (loginAttemptTracker.isBlocked(account.id())) {
      return AuthResult.failure(AuthError.TOO_MANY_ATTEMPTS);
    }
    if (!passwordHasher.verify(password, account.passwordHash())) {
      loginAttemptTracker.recordAttempt(account.id(), false);
      log.info("Failed login for account {}", account.id());
      return AuthResult.failure(AuthError.INVALID_CREDENTIALS);
    }

    loginAttemptTracker.recordAttempt(account.id(), true);
    ClaimsInput input = new ClaimsInput(account.id(), account.username(), account.role());
    IssuedToken access = tokenManager.issue(input, config.accessTokenTtl());
    IssuedToken refresh = tokenManager.issue(input, config.refreshTokenTtl());
    sessionStore.create(account.id(), refresh.token(), config.refreshTokenTtl());
    accountStore.recordLogin(account.id(), clock.instant());
    log.info("Account {} logged in", account.id());

    return AuthResult.success(new LoginResult(account, access.claims(), access.token(), refresh.token(),
        config.accessTokenTtl().getSeconds()));
  }

  // ── Refresh / logout ─────────────────────────────────────────────────────

  /**
   * Exchanges a refresh token bound to a live session for a new access token.
   * <p>
   * With rotation enabled a new refresh token replaces the session, invalidating the old one.
   *
   * @return new tokens; {@link AuthError#TOKEN_EXPIRED}, {@link AuthError#TOKEN_MALFORMED} or
   *     {@link AuthError#SESSION_INVALID} otherwise
   */
  public AuthResult<RefreshResult> refresh(String refreshToken) {
    log.debug("refresh()");
    AuthResult<Claims> verified = tokenManager.verify(refreshToken);
    if (verified.isFailure()) {
      return verified.propagate();
    }
    Claims claims = verified.value();
    if (!sessionStore.verify(claims.subject(), refreshToken)) {
      log.debug("Refresh token for subject {} does not match a live session", claims.subject());
      return AuthResult.failure(AuthError.SESSION_INVALID);
    }

    ClaimsInput input = new ClaimsInput(claims.subject(), claims.username(), claims.role());
    IssuedToken access = tokenManager.issue(input, config.accessTokenTtl());
    String nextRefreshToken = refreshToken;
    if (config.rotateRefreshTokens()) {
      nextRefreshToken = tokenManager.issue(input, config.refreshTokenTtl()).token();
      sessionStore.create(claims.subject(), nextRefreshToken, config.refreshTokenTtl());
    }
    return AuthResult.success(new RefreshResult(access.token(), nextRefreshToken,
        config.accessTokenTtl().getSeconds()));
  }

  /**
   * Ends the session the refresh token belongs to. An unusable token is silently ignored.
   */
  public void logout(String refreshToken) {
    log.debug("logout()");
    AuthResult<Claims> verified = tokenManager.verify(refreshToken);
    if (verified.isFailure()) {
      log.debug("Ignoring logout with unusable token: {}", verified.error());
      return;
    }
    sessionStore.invalidate(verified.value().subject());
  }

  /**
   * Ends every session of the account, e.g. after a password change or account suspension.
   * Access tokens already issued remain valid until they expire.
   */
  public void revokeAllSessions(String userId) {
    sessionStore.invalidate(userId);
    log.info("Revoked sessions for account {}", userId);
  }

  // ── Access tokens ────────────────────────────────────────────────────────

  /**
   * Validates a bearer access token without touching the store.
   */
  public AuthResult<Claims> authenticate(String accessToken) {
    return tokenManager.verify(accessToken);
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Creates an account after structural checks.
   *
   * @return the account; {@link AuthError#INVALID_REQUEST} or {@link AuthError#ACCOUNT_EXISTS} otherwise
   */
  public AuthResult<Account> register(String username, String email, String password, Role role) {
    log.debug("register()");
    if (username == null || !USERNAME.matcher(username).matches()
        || email == null || email.length() > MAX_EMAIL_LENGTH || !EMAIL.matcher(email).matches()
        || password == null || password.length() < MIN_PASSWORD_LENGTH
        || password.getBytes(StandardCharsets.UTF_8).length > PasswordHasher.MAX_PASSWORD_BYTES
        || role == null) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    if (accountStore.findByUsernameOrEmail(username).isPresent()
        || accountStore.findByUsernameOrEmail(email).isPresent()) {
      return AuthResult.failure(AuthError.ACCOUNT_EXISTS);
    }
    Account account = new Account(UUID.randomUUID().toString(), username, email,
        passwordHasher.hash(password), role, true, null);
    if (!accountStore.create(account)) {
      return AuthResult.failure(AuthError.ACCOUNT_EXISTS);
    }
    log.info("Registered account {}", account.id());
    return AuthResult.success(account);
  }
}
