package com.codeheadsystems.gatekeeper.crypto;

import com.codeheadsystems.gatekeeper.crypto.config.HashAlgorithm;
import com.codeheadsystems.gatekeeper.crypto.exception.InvalidInputException;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;

/**
 * Converts plaintext passwords into self-describing digests and verifies passwords against them.
 * <p>
 * A digest encodes the algorithm identifier, cost parameters, salt and output in one string,
 * so verification needs nothing but the digest. Implementations are stateless and thread-safe.
 */
public interface PasswordHasher {

  /**
   * The algorithm this hasher uses for new digests.
   *
   * @return the hash algorithm
   */
  HashAlgorithm algorithm();

  /**
   * Hashes a plaintext password with a fresh random salt.
   *
   * @param plaintext the password
   * @return the digest
   * @throws InvalidInputException if the plaintext is null or empty
   */
  String hash(String plaintext);

  /**
   * Verifies a plaintext password against a stored digest in constant time.
   *
   * @param plaintext the candidate password
   * @param digest    the stored digest
   * @return true only if the password produced the digest
   * @throws InvalidInputException    if the plaintext is null
   * @throws MalformedDigestException if the digest cannot be parsed
   */
  boolean verify(String plaintext, String digest);

  /**
   * True when the digest was produced by a different algorithm or with weaker cost parameters
   * than this hasher would use today. Callers holding the plaintext should hash it again.
   *
   * @param digest the stored digest
   * @return the boolean
   * @throws MalformedDigestException if the digest belongs to this hasher's algorithm but cannot
   *                                  be parsed
   */
  boolean needsRehash(String digest);

  /**
   * Rejects null or empty plaintext for {@link #hash(String)}.
   *
   * @param plaintext the plaintext
   */
  static void requirePlaintext(String plaintext) {
    if (plaintext == null || plaintext.isEmpty()) {
      throw new InvalidInputException("Password must not be empty");
    }
  }
}
