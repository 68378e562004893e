package com.codeheadsystems.gatekeeper.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.gatekeeper.crypto.DelegatingPasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.common.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.config.HashConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PasswordHasherHealthCheckTest {

  @Mock private PasswordHasher hasher;

  @Test
  void realHasher_healthy() {
    PasswordHasherHealthCheck check = new PasswordHasherHealthCheck(
        DelegatingPasswordHasher.fromConfig(HashConfig.forTesting()), new RandomProvider());

    HealthCheck.Result result = check.execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("algorithm=ARGON2ID");
  }

  @Test
  void probeDoesNotVerify_unhealthy() {
    when(hasher.hash(anyString())).thenReturn("$argon2id$probe");
    when(hasher.verify(anyString(), eq("$argon2id$probe"))).thenReturn(false);

    HealthCheck.Result result = new PasswordHasherHealthCheck(hasher, new RandomProvider()).execute();

    assertThat(result.isHealthy()).isFalse();
  }

  @Test
  void hasherThrows_unhealthy() {
    when(hasher.hash(anyString())).thenThrow(new IllegalStateException("no entropy"));

    HealthCheck.Result result = new PasswordHasherHealthCheck(hasher, new RandomProvider()).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("no entropy");
  }
}
