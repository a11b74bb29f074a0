package com.codeheadsystems.warden.integration;

import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.AlgorithmParameterSpec;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

/**
 * Generates a key pair per token purpose and points the configuration at PEM files holding them.
 */
final class PemFiles {

  private PemFiles() {
  }

  static KeyPair generate(final String algorithm, final AlgorithmParameterSpec spec) {
    try {
      final KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm);
      generator.initialize(spec);
      return generator.generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to generate " + algorithm + " key pair", e);
    }
  }

  static void install(final WardenConfiguration configuration,
                      final Path dir,
                      final String algorithm,
                      final AlgorithmParameterSpec spec) {
    for (TokenPurpose purpose : TokenPurpose.values()) {
      final KeyPair pair = generate(algorithm, spec);
      final Path privateKey = write(dir.resolve(purpose.claimValue() + "-private.pem"), pair.getPrivate());
      final Path publicKey = write(dir.resolve(purpose.claimValue() + "-public.pem"), pair.getPublic());
      configuration.getSecrets().forPurpose(purpose).setPrivateKeyPemPath(privateKey.toString());
      configuration.getSecrets().forPurpose(purpose).setPublicKeyPemPath(publicKey.toString());
    }
  }

  private static Path write(final Path path, final Object key) {
    try (Writer writer = Files.newBufferedWriter(path); JcaPEMWriter pem = new JcaPEMWriter(writer)) {
      pem.writeObject(key);
      return path;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
