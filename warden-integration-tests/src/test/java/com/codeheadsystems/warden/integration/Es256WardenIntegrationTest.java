package com.codeheadsystems.warden.integration;

import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.secret.RotatingSecretStore;
import java.nio.file.Path;
import java.security.spec.ECGenParameterSpec;

class Es256WardenIntegrationTest extends AbstractWardenIntegrationTest {

  private static final ECGenParameterSpec P256 = new ECGenParameterSpec("secp256r1");

  @Override
  protected String algorithm() {
    return "ES256";
  }

  @Override
  protected void installKeys(final WardenConfiguration configuration, final Path dir) {
    PemFiles.install(configuration, dir, "EC", P256);
  }

  @Override
  protected void rotateAccessKey(final RotatingSecretStore secretStore) {
    secretStore.rotate(TokenPurpose.ACCESS, PemFiles.generate("EC", P256));
  }
}
