package com.codeheadsystems.warden.integration;

import static com.codeheadsystems.warden.integration.AbstractWardenIntegrationTest.ALICE;
import static com.codeheadsystems.warden.integration.AbstractWardenIntegrationTest.BROWSER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.model.TokenPair;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.model.ValidationVerdict;
import com.codeheadsystems.warden.server.config.ConfigurationLoader;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.manager.Warden;
import com.codeheadsystems.warden.server.store.SessionRegistry;
import com.codeheadsystems.warden.server.store.StoreUnavailableException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * A session store that refuses every call, plugged in the way a deployment would plug in a shared one.
 */
class StoreOutageIntegrationTest {

  private static SessionRegistry unreachable() {
    return mock(SessionRegistry.class, invocation -> {
      throw new IllegalStateException("connection refused");
    });
  }

  private static Warden warden(final Map<String, String> overrides) {
    final Map<String, String> environment = new HashMap<>(Hs256WardenIntegrationTest.SECRETS);
    environment.putAll(overrides);
    final WardenConfiguration configuration =
        new ConfigurationLoader(environment).loadResource("warden-integration.yml");
    return Warden.builder(configuration)
        .clock(new MutableClock(Instant.parse("2026-03-01T09:00:00Z")))
        .sessionRegistry(unreachable())
        .startSweeper(false)
        .build();
  }

  @Test
  void sessionOutage_failsOpenWithWarning_andReportsUnhealthy() {
    try (Warden warden = warden(Map.of())) {
      final TokenPair pair = warden.manager().issueTokenPair(ALICE, BROWSER);

      final ValidationVerdict verdict = warden.manager().validate(pair.accessToken(), TokenPurpose.ACCESS, BROWSER);

      assertThat(verdict.valid()).isTrue();
      assertThat(verdict.warnings()).containsExactly("Session store unavailable");
      assertThat(warden.metricRegistry().meter("warden.store.session.failures").getCount()).isEqualTo(3);
      final HealthCheck.Result health = warden.healthCheck().execute();
      assertThat(health.isHealthy()).isFalse();
      assertThat(health.getMessage()).startsWith("store outage: session (3 failures since");
    }
  }

  @Test
  void sessionOutage_inStrictMode_refusesLogin() {
    try (Warden warden = warden(Map.of("WARDEN_STRICT_MODE", "true"))) {
      assertThatThrownBy(() -> warden.manager().issueTokenPair(ALICE, BROWSER))
          .isInstanceOf(StoreUnavailableException.class)
          .hasMessageContaining("session store");

      // Purpose tokens carry no session and keep working.
      final String reset = warden.manager().issuePurposeToken(ALICE, TokenPurpose.PASSWORD_RESET, null).token();
      assertThat(warden.manager().redeem(reset, TokenPurpose.PASSWORD_RESET, BROWSER).valid()).isTrue();
    }
  }
}
