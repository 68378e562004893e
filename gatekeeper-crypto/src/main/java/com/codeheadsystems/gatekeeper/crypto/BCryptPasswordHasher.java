package com.codeheadsystems.gatekeeper.crypto;

import com.codeheadsystems.gatekeeper.crypto.config.HashAlgorithm;
import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import com.codeheadsystems.gatekeeper.crypto.exception.InvalidInputException;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;

/**
 * OpenBSD bcrypt password hasher.
 * <p>
 * New digests use version {@code 2b}; {@code 2a} and {@code 2y} digests verify as well.
 * bcrypt only reads the first 72 bytes of the UTF-8 encoded password.
 */
public class BCryptPasswordHasher implements PasswordHasher {

  private static final String VERSION = "2b";
  private static final Pattern DIGEST = Pattern.compile("^\\$2[aby]\\$(\\d{2})\\$[./A-Za-z0-9]{53}$");

  private final HashConfig config;

  /**
   * Instantiates a new BCrypt password hasher.
   *
   * @param config the hash config
   */
  public BCryptPasswordHasher(HashConfig config) {
    this.config = config;
  }

  @Override
  public HashAlgorithm algorithm() {
    return HashAlgorithm.BCRYPT;
  }

  @Override
  public String hash(String plaintext) {
    PasswordHasher.requirePlaintext(plaintext);
    byte[] salt = config.randomProvider().randomBytes(HashConfig.SALT_LENGTH);
    return OpenBSDBCrypt.generate(VERSION, plaintext.toCharArray(), salt, config.bcryptCost());
  }

  @Override
  public boolean verify(String plaintext, String digest) {
    if (plaintext == null) {
      throw new InvalidInputException("Password must not be null");
    }
    parseCost(digest);
    try {
      return OpenBSDBCrypt.checkPassword(digest, plaintext.toCharArray());
    } catch (IllegalArgumentException | DataLengthException e) {
      throw new MalformedDigestException("bcrypt digest could not be decoded", e);
    }
  }

  @Override
  public boolean needsRehash(String digest) {
    if (!HashAlgorithm.BCRYPT.matches(digest)) {
      return true;
    }
    return parseCost(digest) < config.bcryptCost();
  }

  private static int parseCost(String digest) {
    if (digest == null) {
      throw new MalformedDigestException("bcrypt digest is missing");
    }
    Matcher matcher = DIGEST.matcher(digest);
    if (!matcher.matches()) {
      throw new MalformedDigestException("Not a bcrypt digest");
    }
    int cost = Integer.parseInt(matcher.group(1));
    if (cost < HashConfig.MIN_BCRYPT_COST || cost > HashConfig.MAX_BCRYPT_COST) {
      throw new MalformedDigestException("bcrypt cost out of range");
    }
    return cost;
  }
}
