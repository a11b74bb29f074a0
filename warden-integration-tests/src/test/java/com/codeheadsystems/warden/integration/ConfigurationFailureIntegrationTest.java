package com.codeheadsystems.warden.integration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.server.config.ConfigurationException;
import com.codeheadsystems.warden.server.config.ConfigurationLoader;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.manager.Warden;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Startup must refuse configurations that would produce forgeable or unusable tokens.
 */
class ConfigurationFailureIntegrationTest {

  @TempDir
  Path keyDir;

  private static WardenConfiguration load(final Map<String, String> overrides) {
    final Map<String, String> environment = new HashMap<>(Hs256WardenIntegrationTest.SECRETS);
    environment.putAll(overrides);
    return new ConfigurationLoader(environment).loadResource("warden-integration.yml");
  }

  @Test
  void shortSecretFromEnvironment_isRejected() {
    final WardenConfiguration configuration = load(Map.of("WARDEN_ACCESS_SECRET", "hunter2-Zx9!"));

    assertThatThrownBy(() -> Warden.builder(configuration).startSweeper(false).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("secrets.access.secret must be at least 32 bytes long");
  }

  @Test
  void sharedSecret_isRejected() {
    final WardenConfiguration configuration =
        load(Map.of("WARDEN_REFRESH_SECRET", Hs256WardenIntegrationTest.SECRETS.get("WARDEN_ACCESS_SECRET")));

    assertThatThrownBy(() -> Warden.builder(configuration).startSweeper(false).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("must use different secrets");
  }

  @Test
  void missingSecret_isRejected() {
    final WardenConfiguration configuration =
        new ConfigurationLoader(Map.of()).loadResource("warden-integration.yml");

    assertThatThrownBy(() -> Warden.builder(configuration).startSweeper(false).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("secrets.access.secret is required");
  }

  @Test
  void rsaWithoutKeyFiles_isRejected() {
    final WardenConfiguration configuration = load(Map.of());
    configuration.getTokens().setAlgorithm("RS256");

    assertThatThrownBy(() -> Warden.builder(configuration).startSweeper(false).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("PEM path is required");
  }

  @Test
  void unreadablePemFile_isRejected() {
    final WardenConfiguration configuration = load(Map.of());
    configuration.getTokens().setAlgorithm("ES256");
    configuration.getSecrets().getAccess().setPublicKeyPemPath(keyDir.resolve("missing.pem").toString());

    assertThatThrownBy(() -> Warden.builder(configuration).startSweeper(false).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("missing.pem");
  }

  @Test
  void invalidSessionCap_isRejectedByTheLoader() {
    assertThatThrownBy(() -> load(Map.of("WARDEN_MAX_CONCURRENT_SESSIONS", "many")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("WARDEN_MAX_CONCURRENT_SESSIONS");
  }
}
