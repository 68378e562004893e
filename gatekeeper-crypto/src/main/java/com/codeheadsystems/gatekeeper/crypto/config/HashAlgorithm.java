package com.codeheadsystems.gatekeeper.crypto.config;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Password hashing algorithms, identified in a digest by its leading {@code $id$} segment.
 * <p>
 * Supported algorithms:
 * <ul>
 *   <li>ARGON2ID: Argon2id, PHC string format ({@code $argon2id$v=19$m=..,t=..,p=..$salt$hash})</li>
 *   <li>BCRYPT: OpenBSD bcrypt ({@code $2b$cost$saltAndHash}); {@code 2a} and {@code 2y} verify too</li>
 * </ul>
 */
public enum HashAlgorithm {

  ARGON2ID(List.of("$argon2id$")),
  BCRYPT(List.of("$2b$", "$2a$", "$2y$"));

  private final List<String> prefixes;

  HashAlgorithm(List<String> prefixes) {
    this.prefixes = prefixes;
  }

  /**
   * Returns the algorithm for the given configuration name. Accepted names: {@code "ARGON2ID"},
   * {@code "BCRYPT"} (case-insensitive).
   *
   * @param name the name
   * @return the hash algorithm
   * @throws IllegalArgumentException for unrecognised names
   */
  public static HashAlgorithm fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Hash algorithm name is required");
    }
    return switch (name.toUpperCase(Locale.ROOT)) {
      case "ARGON2ID" -> ARGON2ID;
      case "BCRYPT" -> BCRYPT;
      default -> throw new IllegalArgumentException("Unknown hash algorithm: " + name
          + ". Valid values: ARGON2ID, BCRYPT");
    };
  }

  /**
   * Identifies which algorithm produced a digest from its leading identifier.
   *
   * @param digest the stored digest
   * @return the algorithm, or empty if the identifier is not recognised
   */
  public static Optional<HashAlgorithm> identify(String digest) {
    if (digest == null) {
      return Optional.empty();
    }
    for (HashAlgorithm algorithm : values()) {
      if (algorithm.matches(digest)) {
        return Optional.of(algorithm);
      }
    }
    return Optional.empty();
  }

  /**
   * True if the digest starts with one of this algorithm's identifiers.
   *
   * @param digest the digest
   * @return the boolean
   */
  public boolean matches(String digest) {
    return digest != null && prefixes.stream().anyMatch(digest::startsWith);
  }
}
