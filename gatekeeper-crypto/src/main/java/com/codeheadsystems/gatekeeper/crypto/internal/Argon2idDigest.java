package com.codeheadsystems.gatekeeper.crypto.internal;

import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Parsed form of an Argon2id digest in PHC string format:
 * <pre>{@code
 *   $argon2id$v=19$m=65536,t=3,p=1$<salt>$<hash>
 * }</pre>
 * Salt and hash are standard base64 without padding. The byte array components are copied
 * in and out, and equality compares their contents.
 *
 * @param memoryKib   memory cost in kibibytes
 * @param iterations  iteration count
 * @param parallelism lanes
 * @param salt        raw salt bytes
 * @param hash        raw Argon2id output
 */
public record Argon2idDigest(int memoryKib, int iterations, int parallelism, byte[] salt, byte[] hash) {

  public static final int VERSION = 0x13;

  // Upper bounds reject digests that would make a single verification unreasonably expensive.
  static final int MAX_MEMORY_KIB = HashConfig.MAX_ARGON2_MEMORY_KIB;
  static final int MAX_ITERATIONS = 1024;
  static final int MAX_PARALLELISM = 255;
  static final int MIN_SALT_LENGTH = 8;
  static final int MIN_HASH_LENGTH = 16;

  private static final String ID = "argon2id";
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Copies the salt and hash.
   */
  public Argon2idDigest {
    salt = salt.clone();
    hash = hash.clone();
  }

  /**
   * Parses a PHC string.
   *
   * @param digest the stored digest
   * @return the parsed digest
   * @throws MalformedDigestException if the digest is not a well-formed Argon2id PHC string
   */
  public static Argon2idDigest parse(String digest) {
    if (digest == null) {
      throw new MalformedDigestException("Argon2id digest is missing");
    }
    // Leading '$' yields an empty first segment.
    String[] parts = digest.split("\\$", -1);
    if (parts.length != 6 || !parts[0].isEmpty() || !ID.equals(parts[1])) {
      throw new MalformedDigestException("Not an Argon2id PHC string");
    }
    if (!("v=" + VERSION).equals(parts[2])) {
      throw new MalformedDigestException("Unsupported Argon2 version");
    }
    int memory = -1;
    int iterations = -1;
    int parallelism = -1;
    String[] params = parts[3].split(",", -1);
    if (params.length != 3) {
      throw new MalformedDigestException("Argon2id parameters must be m, t and p");
    }
    for (String param : params) {
      int eq = param.indexOf('=');
      if (eq != 1) {
        throw new MalformedDigestException("Malformed Argon2id parameter");
      }
      int value = parseBounded(param.substring(2));
      switch (param.charAt(0)) {
        case 'm' -> memory = value;
        case 't' -> iterations = value;
        case 'p' -> parallelism = value;
        default -> throw new MalformedDigestException("Unknown Argon2id parameter");
      }
    }
    if (memory < 0 || iterations < 0 || parallelism < 0) {
      throw new MalformedDigestException("Argon2id parameters must be m, t and p");
    }
    if (parallelism < 1 || parallelism > MAX_PARALLELISM
        || iterations < 1 || iterations > MAX_ITERATIONS
        || memory < 8 * parallelism || memory > MAX_MEMORY_KIB) {
      throw new MalformedDigestException("Argon2id parameters out of range");
    }
    byte[] salt = decode(parts[4]);
    byte[] hash = decode(parts[5]);
    if (salt.length < MIN_SALT_LENGTH || hash.length < MIN_HASH_LENGTH) {
      throw new MalformedDigestException("Argon2id salt or hash too short");
    }
    return new Argon2idDigest(memory, iterations, parallelism, salt, hash);
  }

  private static int parseBounded(String value) {
    // Ten digits or fewer keeps Integer.parseInt from overflowing on anything we accept.
    if (value.isEmpty() || value.length() > 10 || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new MalformedDigestException("Argon2id parameter is not a number");
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new MalformedDigestException("Argon2id parameter is not a number", e);
    }
  }

  private static byte[] decode(String value) {
    if (value.isEmpty()) {
      throw new MalformedDigestException("Argon2id salt or hash is empty");
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new MalformedDigestException("Argon2id salt or hash is not base64", e);
    }
  }

  /**
   * Encodes this digest as a PHC string.
   *
   * @return the string
   */
  public String encode() {
    return "$" + ID
        + "$v=" + VERSION
        + "$m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
        + "$" + B64.encodeToString(salt)
        + "$" + B64.encodeToString(hash);
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] hash() {
    return hash.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Argon2idDigest other)) {
      return false;
    }
    return memoryKib == other.memoryKib
        && iterations == other.iterations
        && parallelism == other.parallelism
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(hash, other.hash);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(memoryKib);
    result = 31 * result + Integer.hashCode(iterations);
    result = 31 * result + Integer.hashCode(parallelism);
    result = 31 * result + Arrays.hashCode(salt);
    return 31 * result + Arrays.hashCode(hash);
  }

  @Override
  public String toString() {
    return "Argon2idDigest[m=" + memoryKib + ", t=" + iterations + ", p=" + parallelism
        + ", saltLength=" + salt.length + ", hashLength=" + hash.length + "]";
  }
}
