package com.codeheadsystems.gatekeeper.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.common.RandomProvider;

/**
 * Health check that hashes and verifies a random probe password with the configured hasher.
 */
public class PasswordHasherHealthCheck extends HealthCheck {

  private final PasswordHasher hasher;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Password hasher health check.
   *
   * @param hasher         the hasher
   * @param randomProvider source of probe passwords
   */
  public PasswordHasherHealthCheck(PasswordHasher hasher, RandomProvider randomProvider) {
    this.hasher = hasher;
    this.randomProvider = randomProvider;
  }

  @Override
  protected Result check() {
    String probe = randomProvider.randomToken(16);
    long start = System.nanoTime();
    String digest = hasher.hash(probe);
    if (!hasher.verify(probe, digest)) {
      return Result.unhealthy("Probe password did not verify against its own digest");
    }
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
    return Result.healthy("algorithm=%s roundTripMillis=%d", hasher.algorithm(), elapsedMillis);
  }
}
