package com.codeheadsystems.vionex.dropwizard;

import com.codeheadsystems.vionex.dropwizard.auth.VionexAuthenticator;
import com.codeheadsystems.vionex.dropwizard.auth.VionexPrincipal;
import com.codeheadsystems.vionex.dropwizard.health.KeyValueStoreHealthCheck;
import com.codeheadsystems.vionex.server.auth.PasswordHasher;
import com.codeheadsystems.vionex.server.auth.TokenManager;
import com.codeheadsystems.vionex.server.auth.TwoFactorStub;
import com.codeheadsystems.vionex.server.config.AuthConfig;
import com.codeheadsystems.vionex.server.manager.AuthenticationManager;
import com.codeheadsystems.vionex.server.ratelimit.LoginAttemptTracker;
import com.codeheadsystems.vionex.server.ratelimit.RateLimiter;
import com.codeheadsystems.vionex.server.ratelimit.SlidingWindowCounter;
import com.codeheadsystems.vionex.server.resource.AuthResource;
import com.codeheadsystems.vionex.server.resource.InfrastructureExceptionMapper;
import com.codeheadsystems.vionex.server.resource.RateLimitFilter;
import com.codeheadsystems.vionex.server.store.AccountStore;
import com.codeheadsystems.vionex.server.store.InMemoryAccountStore;
import com.codeheadsystems.vionex.server.store.InMemoryKeyValueStore;
import com.codeheadsystems.vionex.server.store.KeyValueSessionStore;
import com.codeheadsystems.vionex.server.store.KeyValueStore;
import com.codeheadsystems.vionex.server.store.RedisKeyValueStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Vionex auth services into an existing Dropwizard application.
 * <p>
 * Registers the {@code /auth} resource, the per-client rate-limit filter, the bearer token
 * authentication filter and a health check on the shared key/value store. Requires a
 * {@link VionexConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with an in-memory account store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new VionexAuthBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent account store:
 * <pre>{@code
 *   bootstrap.addBundle(new VionexAuthBundle<>(myAccountStore));
 * }</pre>
 * Sessions, lockouts and rate windows live in Redis when {@code redisUri} is configured and in
 * process memory otherwise.
 */
@Singleton
public class VionexAuthBundle<C extends VionexConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(VionexAuthBundle.class);

  private final AccountStore accountStore;
  private final Clock clock;
  private AuthenticationManager authenticationManager;

  /**
   * Creates a bundle backed by an in-memory account store.
   * <p>
   * For dev/test only. All accounts are lost on restart.
   */
  public VionexAuthBundle() {
    this(new InMemoryAccountStore(), Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory account store. All accounts will  #
        # be lost on restart.                                           #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied account store.
   *
   * @param accountStore the account store
   */
  @Inject
  public VionexAuthBundle(AccountStore accountStore) {
    this(accountStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied account store and clock.
   *
   * @param accountStore the account store
   * @param clock        clock used for token timestamps and rate windows
   */
  public VionexAuthBundle(AccountStore accountStore, Clock clock) {
    this.accountStore = accountStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    AuthConfig authConfig = configuration.toAuthConfig(buildSecret(configuration));
    KeyValueStore keyValueStore = buildKeyValueStore(configuration, environment);
    SlidingWindowCounter counter = new SlidingWindowCounter(keyValueStore);

    authenticationManager = new AuthenticationManager(
        authConfig,
        accountStore,
        new PasswordHasher(authConfig.bcryptCost()),
        new TokenManager(authConfig.secret(), authConfig.issuer(), clock),
        new LoginAttemptTracker(counter, authConfig.loginAttempts(), clock),
        new KeyValueSessionStore(keyValueStore, clock),
        clock);
    RateLimiter rateLimiter = new RateLimiter(counter, authConfig.rateLimit(), clock);

    environment.jersey().register(new AuthResource(authenticationManager, new TwoFactorStub()));
    environment.jersey().register(new RateLimitFilter(rateLimiter, configuration.getRateLimitTrustedProxies()));
    environment.jersey().register(new InfrastructureExceptionMapper());
    environment.healthChecks().register("key-value-store", new KeyValueStoreHealthCheck(keyValueStore));

    // Bearer auth filter
    VionexAuthenticator authenticator = new VionexAuthenticator(authenticationManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<VionexPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(VionexPrincipal.class));
  }

  /**
   * The manager built by {@link #run}, for applications that need operations with no HTTP
   * endpoint such as {@link AuthenticationManager#revokeAllSessions(String)}.
   *
   * @return the authentication manager
   * @throws IllegalStateException if the bundle has not run yet
   */
  public AuthenticationManager authenticationManager() {
    if (authenticationManager == null) {
      throw new IllegalStateException("VionexAuthBundle has not been run");
    }
    return authenticationManager;
  }

  private byte[] buildSecret(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      byte[] secret = new byte[32];
      new SecureRandom().nextBytes(secret);
      return secret;
    }
    return HexFormat.of().parseHex(secretHex);
  }

  private KeyValueStore buildKeyValueStore(C configuration, Environment environment) {
    String redisUri = configuration.getRedisUri();
    if (redisUri == null || redisUri.isEmpty()) {
      log.warn("No redisUri configured, keeping sessions and rate windows in memory. "
          + "State is per process and lost on restart. Do not use in production.");
      return new InMemoryKeyValueStore(clock);
    }
    RedisKeyValueStore store = RedisKeyValueStore.connect(redisUri,
        Duration.ofMillis(configuration.getRedisCommandTimeoutMillis()));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // connected eagerly above
      }

      @Override
      public void stop() {
        store.close();
      }
    });
    return store;
  }
}
