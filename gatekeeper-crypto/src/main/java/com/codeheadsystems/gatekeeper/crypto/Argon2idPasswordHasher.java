package com.codeheadsystems.gatekeeper.crypto;

import com.codeheadsystems.gatekeeper.crypto.config.HashAlgorithm;
import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import com.codeheadsystems.gatekeeper.crypto.exception.InvalidInputException;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;
import com.codeheadsystems.gatekeeper.crypto.internal.Argon2idDigest;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Argon2id password hasher producing PHC-format digests.
 * Uses a fresh {@link HashConfig#SALT_LENGTH}-byte salt per digest and the config's Argon2id cost.
 */
public class Argon2idPasswordHasher implements PasswordHasher {

  private final HashConfig config;

  /**
   * Instantiates a new Argon2id password hasher.
   *
   * @param config the hash config
   */
  public Argon2idPasswordHasher(HashConfig config) {
    this.config = config;
  }

  @Override
  public HashAlgorithm algorithm() {
    return HashAlgorithm.ARGON2ID;
  }

  @Override
  public String hash(String plaintext) {
    PasswordHasher.requirePlaintext(plaintext);
    byte[] salt = config.randomProvider().randomBytes(HashConfig.SALT_LENGTH);
    byte[] output = stretch(plaintext, salt, config.argon2MemoryKib(), config.argon2Iterations(),
        config.argon2Parallelism(), HashConfig.ARGON2_HASH_LENGTH);
    return new Argon2idDigest(config.argon2MemoryKib(), config.argon2Iterations(),
        config.argon2Parallelism(), salt, output).encode();
  }

  @Override
  public boolean verify(String plaintext, String digest) {
    if (plaintext == null) {
      throw new InvalidInputException("Password must not be null");
    }
    if (!HashAlgorithm.ARGON2ID.matches(digest)) {
      throw new MalformedDigestException("Digest is not an Argon2id digest");
    }
    Argon2idDigest parsed = Argon2idDigest.parse(digest);
    byte[] candidate = stretch(plaintext, parsed.salt(), parsed.memoryKib(), parsed.iterations(),
        parsed.parallelism(), parsed.hash().length);
    return org.bouncycastle.util.Arrays.constantTimeAreEqual(candidate, parsed.hash());
  }

  @Override
  public boolean needsRehash(String digest) {
    if (!HashAlgorithm.ARGON2ID.matches(digest)) {
      return true;
    }
    Argon2idDigest parsed = Argon2idDigest.parse(digest);
    return parsed.memoryKib() < config.argon2MemoryKib()
        || parsed.iterations() < config.argon2Iterations()
        || parsed.parallelism() != config.argon2Parallelism()
        || parsed.hash().length < HashConfig.ARGON2_HASH_LENGTH
        || parsed.salt().length < HashConfig.SALT_LENGTH;
  }

  private static byte[] stretch(String plaintext, byte[] salt, int memoryKib, int iterations,
                                int parallelism, int outputLength) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memoryKib)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(params);
    byte[] password = plaintext.getBytes(StandardCharsets.UTF_8);
    byte[] output = new byte[outputLength];
    try {
      gen.generateBytes(password, output, 0, output.length);
    } finally {
      Arrays.fill(password, (byte) 0);
    }
    return output;
  }
}
