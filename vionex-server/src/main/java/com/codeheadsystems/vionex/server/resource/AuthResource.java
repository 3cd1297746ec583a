package com.codeheadsystems.vionex.server.resource;

import com.codeheadsystems.vionex.model.auth.ErrorResponse;
import com.codeheadsystems.vionex.model.auth.LoginRequest;
import com.codeheadsystems.vionex.model.auth.LoginResponse;
import com.codeheadsystems.vionex.model.auth.MessageResponse;
import com.codeheadsystems.vionex.model.auth.RefreshRequest;
import com.codeheadsystems.vionex.model.auth.RefreshResponse;
import com.codeheadsystems.vionex.model.auth.RegisterRequest;
import com.codeheadsystems.vionex.model.auth.TwoFactorSecretResponse;
import com.codeheadsystems.vionex.model.auth.TwoFactorVerifyRequest;
import com.codeheadsystems.vionex.model.auth.TwoFactorVerifyResponse;
import com.codeheadsystems.vionex.model.auth.UserSummary;
import com.codeheadsystems.vionex.server.auth.Role;
import com.codeheadsystems.vionex.server.auth.TwoFactorStub;
import com.codeheadsystems.vionex.server.error.AuthError;
import com.codeheadsystems.vionex.server.error.AuthResult;
import com.codeheadsystems.vionex.server.manager.AuthenticationManager;
import com.codeheadsystems.vionex.server.manager.LoginResult;
import com.codeheadsystems.vionex.server.manager.RefreshResult;
import com.codeheadsystems.vionex.server.store.Account;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for password login and session management.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/register}   - create an account with the viewer role</li>
 *   <li>{@code POST /auth/login}      - exchange credentials for access and refresh tokens (rate limited)</li>
 *   <li>{@code POST /auth/refresh}    - exchange a refresh token for a new access token</li>
 *   <li>{@code POST /auth/logout}     - end the session of a refresh token; always succeeds</li>
 *   <li>{@code POST /auth/2fa/secret} - generate a placeholder two-factor secret</li>
 *   <li>{@code POST /auth/2fa/verify} - check a code against the placeholder verifier</li>
 * </ul>
 * <p>
 * Failures are rendered through {@link AuthError#publicError()} so an unknown account and a wrong
 * password produce the same response.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  static final String TOKEN_TYPE = "Bearer";

  private final AuthenticationManager authenticationManager;
  private final TwoFactorStub twoFactorStub;

  public AuthResource(AuthenticationManager authenticationManager, TwoFactorStub twoFactorStub) {
    this.authenticationManager = authenticationManager;
    this.twoFactorStub = twoFactorStub;
  }

  // ── Registration ─────────────────────────────────────────────────────────

  @POST
  @Path("/register")
  public Response register(RegisterRequest req) {
    log.debug("register()");
    if (req == null) {
      return error(AuthError.INVALID_REQUEST);
    }
    AuthResult<Account> result = authenticationManager.register(req.username(), req.email(), req.password(),
        Role.VIEWER);
    if (result.isFailure()) {
      return error(result.error());
    }
    return Response.status(Response.Status.CREATED).entity(summary(result.value())).build();
  }

  // ── Sessions ─────────────────────────────────────────────────────────────

  @POST
  @Path("/login")
  @RateLimited
  public Response login(LoginRequest req) {
    log.debug("login()");
    if (req == null) {
      return error(AuthError.INVALID_REQUEST);
    }
    AuthResult<LoginResult> result = authenticationManager.login(req.username(), req.password());
    if (result.isFailure()) {
      return error(result.error());
    }
    LoginResult login = result.value();
    return Response.ok(new LoginResponse(login.accessToken(), login.refreshToken(), TOKEN_TYPE,
        login.expiresInSeconds(), summary(login.account()))).build();
  }

  @POST
  @Path("/refresh")
  public Response refresh(RefreshRequest req) {
    log.debug("refresh()");
    if (req == null || req.refreshToken() == null) {
      return error(AuthError.INVALID_REQUEST);
    }
    AuthResult<RefreshResult> result = authenticationManager.refresh(req.refreshToken());
    if (result.isFailure()) {
      return error(result.error());
    }
    RefreshResult refresh = result.value();
    return Response.ok(new RefreshResponse(refresh.accessToken(), refresh.refreshToken(), TOKEN_TYPE,
        refresh.expiresInSeconds())).build();
  }

  @POST
  @Path("/logout")
  public MessageResponse logout(RefreshRequest req) {
    log.debug("logout()");
    if (req != null) {
      authenticationManager.logout(req.refreshToken());
    }
    return MessageResponse.ok("Logged out successfully");
  }

  // ── Two-factor placeholder ───────────────────────────────────────────────

  @POST
  @Path("/2fa/secret")
  public TwoFactorSecretResponse twoFactorSecret() {
    return new TwoFactorSecretResponse(twoFactorStub.generateSecret());
  }

  @POST
  @Path("/2fa/verify")
  public Response twoFactorVerify(TwoFactorVerifyRequest req) {
    if (req == null) {
      return error(AuthError.INVALID_REQUEST);
    }
    return Response.ok(new TwoFactorVerifyResponse(twoFactorStub.verifyCode(req.secret(), req.code()))).build();
  }

  private static Response error(AuthError error) {
    AuthError visible = error.publicError();
    return Response.status(visible.httpStatus())
        .entity(ErrorResponse.of(visible.message()))
        .build();
  }

  private static UserSummary summary(Account account) {
    return new UserSummary(account.id(), account.username(), account.email(), account.role().claimValue());
  }
}
