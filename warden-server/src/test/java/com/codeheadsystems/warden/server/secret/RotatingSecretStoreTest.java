package com.codeheadsystems.warden.server.secret;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.model.SecurityEventType;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.MutableClock;
import com.codeheadsystems.warden.server.WardenFixtures;
import com.codeheadsystems.warden.server.config.ConfigurationException;
import com.codeheadsystems.warden.server.config.SecretsConfiguration;
import com.codeheadsystems.warden.server.event.RecentSecurityEvents;
import com.codeheadsystems.warden.server.event.SecurityEventPublisher;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.util.List;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RotatingSecretStoreTest {

  private RecentSecurityEvents recent;
  private SecurityEventPublisher events;

  @BeforeEach
  void setUp() {
    recent = new RecentSecurityEvents(10);
    events = new SecurityEventPublisher(recent, MutableClock.at("2026-01-01T00:00:00Z"));
  }

  @Test
  void fromConfiguration_loadsVersionOnePerPurpose() {
    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(
        WardenFixtures.configuration().getSecrets(), SigningAlgorithm.HS256, events);

    for (TokenPurpose purpose : TokenPurpose.values()) {
      assertThat(store.current(purpose).id()).isEqualTo(new KeyId(purpose, 1));
    }
  }

  @Test
  void fromConfiguration_tenCharacterSecret_fails() {
    SecretsConfiguration secrets = WardenFixtures.configuration().getSecrets();
    secrets.getAccess().setSecret("Kq7#vR2m!Z");

    assertThatThrownBy(() -> RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.HS256, events))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("secrets.access.secret");
  }

  @Test
  void fromConfiguration_missingSecret_fails() {
    SecretsConfiguration secrets = WardenFixtures.configuration().getSecrets();
    secrets.getPasswordReset().setSecret(null);

    assertThatThrownBy(() -> RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.HS256, events))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("secrets.passwordReset.secret is required");
  }

  @Test
  void fromConfiguration_accessEqualsRefresh_fails() {
    SecretsConfiguration secrets = WardenFixtures.configuration().getSecrets();
    secrets.getRefresh().setSecret(WardenFixtures.ACCESS_SECRET);

    assertThatThrownBy(() -> RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.HS256, events))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("different secrets");
  }

  @Test
  void fromConfiguration_previousSecretsBecomeOlderVersions() {
    SecretsConfiguration secrets = WardenFixtures.configuration().getSecrets();
    secrets.getAccess().setPreviousSecrets(List.of(WardenFixtures.ROTATED_SECRET));

    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.HS256, events);

    assertThat(store.current(TokenPurpose.ACCESS).id().version()).isEqualTo(2);
    assertThat(store.find(new KeyId(TokenPurpose.ACCESS, 1))).isPresent();
    assertThat(store.isCurrent(new KeyId(TokenPurpose.ACCESS, 1))).isFalse();
  }

  @Test
  void rotate_keepsRetainedVersionsOnly() {
    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(
        WardenFixtures.configuration().getSecrets(), SigningAlgorithm.HS256, events);

    SigningKey second = store.rotate(TokenPurpose.ACCESS, WardenFixtures.ROTATED_SECRET);
    SigningKey third = store.rotate(TokenPurpose.ACCESS, "Tj8@Wb3#Nq6!Ef1$Ky9%Hs4^Lu7&Dm2*Xc");

    assertThat(second.id().version()).isEqualTo(2);
    assertThat(third.id().version()).isEqualTo(3);
    assertThat(store.current(TokenPurpose.ACCESS)).isEqualTo(third);
    assertThat(store.find(new KeyId(TokenPurpose.ACCESS, 2))).contains(second);
    assertThat(store.find(new KeyId(TokenPurpose.ACCESS, 1))).isEmpty();
    assertThat(store.current(TokenPurpose.REFRESH).id().version()).isEqualTo(1);
    assertThat(recent.recent(10)).extracting(e -> e.type())
        .containsOnly(SecurityEventType.SECRET_ROTATED)
        .hasSize(2);
  }

  @Test
  void rotate_toAnotherPurposesSecret_fails() {
    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(
        WardenFixtures.configuration().getSecrets(), SigningAlgorithm.HS256, events);

    assertThatThrownBy(() -> store.rotate(TokenPurpose.ACCESS, WardenFixtures.REFRESH_SECRET))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("already used for refresh");
    assertThatThrownBy(() -> store.rotate(TokenPurpose.ACCESS, WardenFixtures.ACCESS_SECRET))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("must differ");
  }

  @Test
  void rotate_weakSecret_fails() {
    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(
        WardenFixtures.configuration().getSecrets(), SigningAlgorithm.HS256, events);

    assertThatThrownBy(() -> store.rotate(TokenPurpose.REFRESH, "short"))
        .isInstanceOf(ConfigurationException.class);
    assertThat(store.current(TokenPurpose.REFRESH).id().version()).isEqualTo(1);
  }

  @Test
  void fromConfiguration_rsaPemFiles(@TempDir Path dir) throws Exception {
    SecretsConfiguration secrets = new SecretsConfiguration();
    for (TokenPurpose purpose : TokenPurpose.values()) {
      KeyPair pair = rsaKeyPair(2048);
      Path privatePath = writePem(dir.resolve(purpose.claimValue() + ".key"), pair.getPrivate());
      Path publicPath = writePem(dir.resolve(purpose.claimValue() + ".pub"), pair.getPublic());
      secrets.forPurpose(purpose).setPrivateKeyPemPath(privatePath.toString());
      secrets.forPurpose(purpose).setPublicKeyPemPath(publicPath.toString());
    }

    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.RS256, events);

    assertThat(store.current(TokenPurpose.ACCESS).algorithm().getName()).isEqualTo("RS256");
  }

  @Test
  void fromConfiguration_shortRsaKey_fails(@TempDir Path dir) throws Exception {
    SecretsConfiguration secrets = new SecretsConfiguration();
    for (TokenPurpose purpose : TokenPurpose.values()) {
      KeyPair pair = rsaKeyPair(1024);
      Path privatePath = writePem(dir.resolve(purpose.claimValue() + ".key"), pair.getPrivate());
      secrets.forPurpose(purpose).setPrivateKeyPemPath(privatePath.toString());
    }

    assertThatThrownBy(() -> RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.RS256, events))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("2048");
  }

  @Test
  void fromConfiguration_wrongCurve_fails(@TempDir Path dir) throws Exception {
    SecretsConfiguration secrets = new SecretsConfiguration();
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(new ECGenParameterSpec("secp384r1"));
    for (TokenPurpose purpose : TokenPurpose.values()) {
      KeyPair pair = generator.generateKeyPair();
      secrets.forPurpose(purpose).setPrivateKeyPemPath(
          writePem(dir.resolve(purpose.claimValue() + ".key"), pair.getPrivate()).toString());
      secrets.forPurpose(purpose).setPublicKeyPemPath(
          writePem(dir.resolve(purpose.claimValue() + ".pub"), pair.getPublic()).toString());
    }

    assertThatThrownBy(() -> RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.ES256, events))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("384-bit curve");
  }

  @Test
  void rotate_secretOnAsymmetricStore_fails(@TempDir Path dir) throws Exception {
    SecretsConfiguration secrets = new SecretsConfiguration();
    for (TokenPurpose purpose : TokenPurpose.values()) {
      secrets.forPurpose(purpose).setPrivateKeyPemPath(
          writePem(dir.resolve(purpose.claimValue() + ".key"), rsaKeyPair(2048).getPrivate()).toString());
    }
    RotatingSecretStore store = RotatingSecretStore.fromConfiguration(secrets, SigningAlgorithm.RS256, events);

    assertThatThrownBy(() -> store.rotate(TokenPurpose.ACCESS, WardenFixtures.ROTATED_SECRET))
        .isInstanceOf(ConfigurationException.class);
    assertThat(store.rotate(TokenPurpose.ACCESS, rsaKeyPair(2048)).id().version()).isEqualTo(2);
  }

  private static KeyPair rsaKeyPair(int bits) throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(bits);
    return generator.generateKeyPair();
  }

  private static Path writePem(Path path, Object key) throws Exception {
    try (Writer writer = Files.newBufferedWriter(path); JcaPEMWriter pem = new JcaPEMWriter(writer)) {
      pem.writeObject(key);
    }
    return path;
  }
}
