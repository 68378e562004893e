package com.codeheadsystems.gatekeeper.server.config;

import java.time.Duration;

/**
 * Session issuance settings.
 *
 * @param sessionTtl how long a session stays valid after login
 * @param tokenBytes random bytes behind each token id (at least {@link #MIN_TOKEN_BYTES})
 */
public record SessionConfig(Duration sessionTtl, int tokenBytes) {

  /**
   * 128 bits.
   */
  public static final int MIN_TOKEN_BYTES = 16;

  /**
   * One hour sessions with 256-bit token ids.
   */
  public static final SessionConfig DEFAULT = new SessionConfig(Duration.ofHours(1), 32);

  /**
   * Validates ranges.
   */
  public SessionConfig {
    if (sessionTtl == null || sessionTtl.isNegative() || sessionTtl.isZero()) {
      throw new IllegalArgumentException("sessionTtl must be positive");
    }
    if (tokenBytes < MIN_TOKEN_BYTES) {
      throw new IllegalArgumentException("tokenBytes must be at least " + MIN_TOKEN_BYTES);
    }
  }

  /**
   * Default token size with the given TTL.
   */
  public static SessionConfig withTtl(Duration sessionTtl) {
    return new SessionConfig(sessionTtl, DEFAULT.tokenBytes());
  }
}
