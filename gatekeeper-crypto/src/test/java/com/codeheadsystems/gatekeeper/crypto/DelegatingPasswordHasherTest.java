package com.codeheadsystems.gatekeeper.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.crypto.config.HashAlgorithm;
import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;
import org.junit.jupiter.api.Test;

class DelegatingPasswordHasherTest {

  private static final String PASSWORD = "correcthorse";

  private final DelegatingPasswordHasher argon2Primary =
      DelegatingPasswordHasher.fromConfig(HashConfig.forTesting(HashAlgorithm.ARGON2ID));
  private final DelegatingPasswordHasher bcryptPrimary =
      DelegatingPasswordHasher.fromConfig(HashConfig.forTesting(HashAlgorithm.BCRYPT));

  @Test
  void fromConfig_hashesWithPrimary() {
    assertThat(argon2Primary.algorithm()).isEqualTo(HashAlgorithm.ARGON2ID);
    assertThat(argon2Primary.hash(PASSWORD)).startsWith("$argon2id$");
    assertThat(bcryptPrimary.algorithm()).isEqualTo(HashAlgorithm.BCRYPT);
    assertThat(bcryptPrimary.hash(PASSWORD)).startsWith("$2b$");
  }

  @Test
  void verify_acceptsEitherAlgorithm() {
    String argon2Digest = argon2Primary.hash(PASSWORD);
    String bcryptDigest = bcryptPrimary.hash(PASSWORD);

    assertThat(argon2Primary.verify(PASSWORD, bcryptDigest)).isTrue();
    assertThat(bcryptPrimary.verify(PASSWORD, argon2Digest)).isTrue();
    assertThat(argon2Primary.verify("wrongpass", bcryptDigest)).isFalse();
  }

  @Test
  void needsRehash_nonPrimaryAlgorithm_true() {
    String bcryptDigest = bcryptPrimary.hash(PASSWORD);
    assertThat(argon2Primary.needsRehash(bcryptDigest)).isTrue();
    assertThat(bcryptPrimary.needsRehash(bcryptDigest)).isFalse();
  }

  @Test
  void verify_unknownAlgorithm_throws() {
    assertThatThrownBy(() -> argon2Primary.verify(PASSWORD, "$1$saltsalt$md5cryptdigest"))
        .isInstanceOf(MalformedDigestException.class);
    assertThatThrownBy(() -> argon2Primary.verify(PASSWORD, null))
        .isInstanceOf(MalformedDigestException.class);
  }

  @Test
  void verify_unregisteredAlgorithm_throws() {
    HashConfig config = HashConfig.forTesting();
    DelegatingPasswordHasher argon2Only = new DelegatingPasswordHasher(new Argon2idPasswordHasher(config));
    String bcryptDigest = new BCryptPasswordHasher(config).hash(PASSWORD);

    assertThatThrownBy(() -> argon2Only.verify(PASSWORD, bcryptDigest))
        .isInstanceOf(MalformedDigestException.class);
  }
}
