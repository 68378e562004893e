package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.crypto.DelegatingPasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.common.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.config.HashAlgorithm;
import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import com.codeheadsystems.gatekeeper.dropwizard.health.PasswordHasherHealthCheck;
import com.codeheadsystems.gatekeeper.server.auth.BearerTokenManager;
import com.codeheadsystems.gatekeeper.server.config.SessionConfig;
import com.codeheadsystems.gatekeeper.server.exception.StorageUnavailableException;
import com.codeheadsystems.gatekeeper.server.manager.CredentialManager;
import com.codeheadsystems.gatekeeper.server.store.InMemorySessionStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryUserStore;
import com.codeheadsystems.gatekeeper.server.store.SessionStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the gatekeeper credential kernel into an existing application.
 * <p>
 * Builds the password hasher, {@link CredentialManager} and {@link BearerTokenManager} from a
 * {@link GatekeeperConfiguration}, registers a {@code password-hasher} health check and
 * schedules a periodic purge of expired sessions on a lifecycle-managed executor. The
 * application reaches the managers through {@link #credentialManager()} and
 * {@link #bearerTokenManager()} once the bundle has run.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new GatekeeperBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new GatekeeperBundle<>(myUserStore, mySessionStore));
 * }</pre>
 */
public class GatekeeperBundle<C extends GatekeeperConfiguration> implements ConfiguredBundle<C> {

  /**
   * Name of the registered health check.
   */
  public static final String HEALTH_CHECK_NAME = "password-hasher";

  private static final Logger log = LoggerFactory.getLogger(GatekeeperBundle.class);

  private final UserStore userStore;
  private final SessionStore sessionStore;
  private final RandomProvider randomProvider;

  private CredentialManager credentialManager;
  private BearerTokenManager bearerTokenManager;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only. All users and sessions are lost on restart.
   */
  public GatekeeperBundle() {
    this(new InMemoryUserStore(), new InMemorySessionStore());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory user and session stores.   #
        # All data will be lost on restart.                             #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param userStore    credential storage
   * @param sessionStore session storage
   */
  public GatekeeperBundle(UserStore userStore, SessionStore sessionStore) {
    this.userStore = userStore;
    this.sessionStore = sessionStore;
    this.randomProvider = new RandomProvider();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    HashConfig hashConfig = buildHashConfig(configuration);
    PasswordHasher hasher = DelegatingPasswordHasher.fromConfig(hashConfig);
    SessionConfig sessionConfig = new SessionConfig(
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        configuration.getSessionTokenBytes());
    Clock clock = Clock.systemUTC();

    credentialManager = new CredentialManager(hasher, userStore, sessionStore, clock,
        sessionConfig, randomProvider);
    bearerTokenManager = new BearerTokenManager(buildJwtSecret(configuration),
        configuration.getJwtIssuer(), credentialManager, clock);

    environment.healthChecks().register(HEALTH_CHECK_NAME,
        new PasswordHasherHealthCheck(hasher, randomProvider));
    schedulePurge(environment, configuration.getSessionPurgeIntervalSeconds());
    log.info("Gatekeeper started: algorithm={} sessionTtlSeconds={}",
        hashConfig.algorithm(), configuration.getSessionTtlSeconds());
  }

  /**
   * The credential manager built from configuration.
   *
   * @return the credential manager
   * @throws IllegalStateException if the bundle has not run yet
   */
  public CredentialManager credentialManager() {
    if (credentialManager == null) {
      throw new IllegalStateException("GatekeeperBundle has not been run yet");
    }
    return credentialManager;
  }

  /**
   * The bearer token manager built from configuration.
   *
   * @return the bearer token manager
   * @throws IllegalStateException if the bundle has not run yet
   */
  public BearerTokenManager bearerTokenManager() {
    if (bearerTokenManager == null) {
      throw new IllegalStateException("GatekeeperBundle has not been run yet");
    }
    return bearerTokenManager;
  }

  private void schedulePurge(Environment environment, long intervalSeconds) {
    ScheduledExecutorService executor = environment.lifecycle()
        .scheduledExecutorService("gatekeeper-session-purge-%d")
        .build();
    CredentialManager manager = credentialManager;
    executor.scheduleWithFixedDelay(() -> {
      try {
        manager.purgeExpiredSessions();
      } catch (StorageUnavailableException e) {
        // Leave the schedule running; the next pass retries.
        log.warn("Expired session purge failed", e);
      }
    }, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  private HashConfig buildHashConfig(C configuration) {
    return new HashConfig(
        HashAlgorithm.fromName(configuration.getHashAlgorithm()),
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism(),
        configuration.getBcryptCost(),
        randomProvider);
  }

  private byte[] buildJwtSecret(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Bearer tokens will be invalidated on restart. Do not use in production.");
      return randomProvider.randomBytes(32);
    }
    return HexFormat.of().parseHex(secretHex);
  }
}
