package com.codeheadsystems.warden.integration;

import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.secret.RotatingSecretStore;
import java.math.BigInteger;
import java.nio.file.Path;
import java.security.spec.RSAKeyGenParameterSpec;

class Rs256WardenIntegrationTest extends AbstractWardenIntegrationTest {

  private static final RSAKeyGenParameterSpec RSA_2048 =
      new RSAKeyGenParameterSpec(2048, BigInteger.valueOf(65537));

  @Override
  protected String algorithm() {
    return "RS256";
  }

  @Override
  protected void installKeys(final WardenConfiguration configuration, final Path dir) {
    PemFiles.install(configuration, dir, "RSA", RSA_2048);
  }

  @Override
  protected void rotateAccessKey(final RotatingSecretStore secretStore) {
    secretStore.rotate(TokenPurpose.ACCESS, PemFiles.generate("RSA", RSA_2048));
  }
}
