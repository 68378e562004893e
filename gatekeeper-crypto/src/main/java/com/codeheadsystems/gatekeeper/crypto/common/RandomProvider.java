package com.codeheadsystems.gatekeeper.crypto.common;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for password salts and for session token identifiers.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates an opaque token string carrying {@code numBytes * 8} bits of entropy,
   * encoded as URL-safe base64 without padding so it can travel in cookies and headers as-is.
   *
   * @param numBytes number of random bytes behind the token
   * @return the encoded token
   */
  public String randomToken(int numBytes) {
    return URL_SAFE.encodeToString(randomBytes(numBytes));
  }
}
