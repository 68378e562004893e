package com.codeheadsystems.gatekeeper.crypto;

import com.codeheadsystems.gatekeeper.crypto.config.HashAlgorithm;
import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hashes with one primary algorithm and verifies digests of every registered algorithm.
 * <p>
 * This is the migration path between algorithms and cost settings: old digests keep
 * verifying, and {@link #needsRehash(String)} reports them so callers can upgrade each
 * credential the next time its plaintext is available.
 */
public class DelegatingPasswordHasher implements PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(DelegatingPasswordHasher.class);

  private final PasswordHasher primary;
  private final Map<HashAlgorithm, PasswordHasher> hashers;

  /**
   * Instantiates a new Delegating password hasher.
   *
   * @param primary the hasher for new digests
   * @param others  additional hashers that can verify existing digests
   */
  public DelegatingPasswordHasher(PasswordHasher primary, PasswordHasher... others) {
    this.primary = primary;
    this.hashers = new EnumMap<>(HashAlgorithm.class);
    for (PasswordHasher other : others) {
      hashers.put(other.algorithm(), other);
    }
    hashers.put(primary.algorithm(), primary);
  }

  /**
   * Builds a hasher that uses {@link HashConfig#algorithm()} for new digests and verifies
   * both Argon2id and bcrypt digests with the config's cost parameters.
   *
   * @param config the hash config
   * @return the delegating password hasher
   */
  public static DelegatingPasswordHasher fromConfig(HashConfig config) {
    PasswordHasher argon2 = new Argon2idPasswordHasher(config);
    PasswordHasher bcrypt = new BCryptPasswordHasher(config);
    return config.algorithm() == HashAlgorithm.BCRYPT
        ? new DelegatingPasswordHasher(bcrypt, argon2)
        : new DelegatingPasswordHasher(argon2, bcrypt);
  }

  @Override
  public HashAlgorithm algorithm() {
    return primary.algorithm();
  }

  @Override
  public String hash(String plaintext) {
    return primary.hash(plaintext);
  }

  @Override
  public boolean verify(String plaintext, String digest) {
    return delegateFor(digest).verify(plaintext, digest);
  }

  @Override
  public boolean needsRehash(String digest) {
    PasswordHasher delegate = delegateFor(digest);
    if (delegate != primary) {
      log.debug("Digest uses {} but primary is {}; rehash required",
          delegate.algorithm(), primary.algorithm());
      return true;
    }
    return primary.needsRehash(digest);
  }

  private PasswordHasher delegateFor(String digest) {
    HashAlgorithm algorithm = HashAlgorithm.identify(digest)
        .orElseThrow(() -> new MalformedDigestException("Unrecognised digest algorithm"));
    PasswordHasher delegate = hashers.get(algorithm);
    if (delegate == null) {
      throw new MalformedDigestException("No hasher registered for " + algorithm);
    }
    return delegate;
  }
}
