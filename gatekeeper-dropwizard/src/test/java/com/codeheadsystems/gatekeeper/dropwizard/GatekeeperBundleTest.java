package com.codeheadsystems.gatekeeper.dropwizard;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.store.InMemorySessionStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryUserStore;
import org.junit.jupiter.api.Test;

class GatekeeperBundleTest {

  @Test
  void managersUnavailableBeforeRun() {
    GatekeeperBundle<GatekeeperConfiguration> bundle =
        new GatekeeperBundle<>(new InMemoryUserStore(), new InMemorySessionStore());

    assertThatThrownBy(bundle::credentialManager).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(bundle::bearerTokenManager).isInstanceOf(IllegalStateException.class);
  }
}
