package com.codeheadsystems.gatekeeper.crypto.config;

import com.codeheadsystems.gatekeeper.crypto.common.RandomProvider;

/**
 * Configuration for password hashing.
 * Holds the primary algorithm, the cost parameters of every supported algorithm, and the
 * random source used for salts.
 * <p>
 * Cost parameters only ever apply to new digests. Existing digests carry their own parameters,
 * so raising the cost here never invalidates stored credentials.
 *
 * @param algorithm         algorithm used for new digests
 * @param argon2MemoryKib   Argon2id memory cost in kibibytes
 * @param argon2Iterations  Argon2id iteration count
 * @param argon2Parallelism Argon2id lanes
 * @param bcryptCost        bcrypt log2 work factor (4..31)
 * @param randomProvider    salt source
 */
public record HashConfig(
    HashAlgorithm algorithm,
    int argon2MemoryKib,
    int argon2Iterations,
    int argon2Parallelism,
    int bcryptCost,
    RandomProvider randomProvider
) {

  public static final int SALT_LENGTH = 16;
  public static final int ARGON2_HASH_LENGTH = 32;
  public static final int MIN_BCRYPT_COST = 4;
  /**
   * 1 GiB. Digests claiming more are rejected as malformed.
   */
  public static final int MAX_ARGON2_MEMORY_KIB = 1024 * 1024;
  public static final int MAX_BCRYPT_COST = 31;

  /**
   * Default configuration for production use: Argon2id with 64 MiB, 3 iterations, 1 lane.
   * bcrypt digests still verify at cost 12.
   */
  public static final HashConfig DEFAULT = new HashConfig(
      HashAlgorithm.ARGON2ID,
      65536, 3, 1,
      12,
      new RandomProvider()
  );

  /**
   * Validates parameter ranges.
   */
  public HashConfig {
    if (algorithm == null) {
      throw new IllegalArgumentException("algorithm is required");
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider is required");
    }
    if (argon2Parallelism < 1) {
      throw new IllegalArgumentException("argon2Parallelism must be at least 1");
    }
    if (argon2Iterations < 1) {
      throw new IllegalArgumentException("argon2Iterations must be at least 1");
    }
    if (argon2MemoryKib < 8 * argon2Parallelism) {
      throw new IllegalArgumentException("argon2MemoryKib must be at least 8 * argon2Parallelism");
    }
    if (argon2MemoryKib > MAX_ARGON2_MEMORY_KIB) {
      throw new IllegalArgumentException("argon2MemoryKib must be at most " + MAX_ARGON2_MEMORY_KIB);
    }
    if (bcryptCost < MIN_BCRYPT_COST || bcryptCost > MAX_BCRYPT_COST) {
      throw new IllegalArgumentException("bcryptCost must be between "
          + MIN_BCRYPT_COST + " and " + MAX_BCRYPT_COST);
    }
  }

  /**
   * Creates a cheap Argon2id configuration for tests: 256 KiB, 1 iteration, bcrypt cost 4.
   * Never use outside tests.
   */
  public static HashConfig forTesting() {
    return forTesting(HashAlgorithm.ARGON2ID);
  }

  /**
   * Creates a cheap configuration for tests with the given primary algorithm.
   */
  public static HashConfig forTesting(HashAlgorithm algorithm) {
    return new HashConfig(algorithm, 256, 1, 1, MIN_BCRYPT_COST, new RandomProvider());
  }

  /**
   * Creates an Argon2id configuration with the given cost; bcrypt keeps its default cost.
   */
  public static HashConfig withArgon2id(int memoryKib, int iterations, int parallelism) {
    return new HashConfig(HashAlgorithm.ARGON2ID, memoryKib, iterations, parallelism,
        DEFAULT.bcryptCost(), new RandomProvider());
  }

  /**
   * Creates a bcrypt configuration with the given cost; Argon2id keeps its default cost.
   */
  public static HashConfig withBCrypt(int cost) {
    return new HashConfig(HashAlgorithm.BCRYPT, DEFAULT.argon2MemoryKib(),
        DEFAULT.argon2Iterations(), DEFAULT.argon2Parallelism(), cost, new RandomProvider());
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public HashConfig withRandomProvider(RandomProvider randomProvider) {
    return new HashConfig(algorithm, argon2MemoryKib, argon2Iterations, argon2Parallelism,
        bcryptCost, randomProvider);
  }

  /**
   * Returns a new config identical to this one but with a different primary algorithm.
   */
  public HashConfig withAlgorithm(HashAlgorithm algorithm) {
    return new HashConfig(algorithm, argon2MemoryKib, argon2Iterations, argon2Parallelism,
        bcryptCost, randomProvider);
  }
}
