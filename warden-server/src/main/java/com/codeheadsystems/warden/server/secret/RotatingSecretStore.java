package com.codeheadsystems.warden.server.secret;

import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.warden.model.SecurityEventType;
import com.codeheadsystems.warden.model.Severity;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.config.ConfigurationException;
import com.codeheadsystems.warden.server.config.KeyConfiguration;
import com.codeheadsystems.warden.server.config.SecretsConfiguration;
import com.codeheadsystems.warden.server.event.SecurityEventPublisher;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.interfaces.ECKey;
import java.security.interfaces.RSAKey;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link SecretStore} holding a short history of key versions per purpose.
 * <p>
 * Rotation appends a new current version and keeps the previous ones up to
 * {@code retainedVersions} in total, so tokens signed just before a rotation keep verifying until
 * they expire or their version is dropped.
 */
public class RotatingSecretStore implements SecretStore {

  private static final Logger log = LoggerFactory.getLogger(RotatingSecretStore.class);

  private final SigningAlgorithm algorithm;
  private final SecretStrengthValidator validator;
  private final int retainedVersions;
  private final SecurityEventPublisher events;
  // Newest last. Guarded by this.
  private final Map<TokenPurpose, List<SigningKey>> keys = new EnumMap<>(TokenPurpose.class);
  // Fingerprint of each purpose's current key material, used to keep purposes on distinct keys.
  private final Map<TokenPurpose, String> fingerprints = new EnumMap<>(TokenPurpose.class);

  RotatingSecretStore(final SigningAlgorithm algorithm,
                      final SecretStrengthValidator validator,
                      final int retainedVersions,
                      final SecurityEventPublisher events) {
    if (retainedVersions < 1) {
      throw new ConfigurationException("secrets.retainedVersions must be at least 1");
    }
    this.algorithm = algorithm;
    this.validator = validator;
    this.retainedVersions = retainedVersions;
    this.events = events;
  }

  /**
   * Builds a store from configuration, validating every key.
   *
   * @param configuration secrets section
   * @param algorithm     configured signing algorithm
   * @param events        receives rotation events
   * @return the populated store
   * @throws ConfigurationException when any key is missing, weak or shared between purposes
   */
  public static RotatingSecretStore fromConfiguration(final SecretsConfiguration configuration,
                                                      final SigningAlgorithm algorithm,
                                                      final SecurityEventPublisher events) {
    final SecretStrengthValidator validator =
        new SecretStrengthValidator(configuration.effectiveMinimumLength());
    final RotatingSecretStore store =
        new RotatingSecretStore(algorithm, validator, configuration.getRetainedVersions(), events);
    if (algorithm.isHmac()) {
      store.loadSecrets(configuration);
    } else {
      store.loadKeyPairs(configuration);
    }
    log.info("Loaded {} signing keys for {} purposes (retaining {} versions)",
        algorithm, TokenPurpose.values().length, configuration.getRetainedVersions());
    return store;
  }

  private void loadSecrets(final SecretsConfiguration configuration) {
    final Map<String, String> current = new LinkedHashMap<>();
    for (TokenPurpose purpose : TokenPurpose.values()) {
      final String name = settingName(purpose);
      final KeyConfiguration key = configuration.forPurpose(purpose);
      validator.validateSecret(name + ".secret", key.getSecret());
      current.put(name + ".secret", key.getSecret());
      final List<String> history = new ArrayList<>(key.getPreviousSecrets());
      for (int i = 0; i < history.size(); i++) {
        validator.validateSecret(name + ".previousSecrets[" + i + "]", history.get(i));
      }
      history.add(key.getSecret());
      final List<SigningKey> versions = new ArrayList<>();
      for (int i = 0; i < history.size(); i++) {
        versions.add(new SigningKey(new KeyId(purpose, i + 1),
            algorithm.hmac(history.get(i).getBytes(StandardCharsets.UTF_8))));
      }
      keys.put(purpose, retain(versions));
      fingerprints.put(purpose, fingerprint(key.getSecret().getBytes(StandardCharsets.UTF_8)));
    }
    validator.validateDistinct(current);
  }

  private void loadKeyPairs(final SecretsConfiguration configuration) {
    for (TokenPurpose purpose : TokenPurpose.values()) {
      final String name = settingName(purpose);
      final KeyConfiguration key = configuration.forPurpose(purpose);
      final KeyPair pair = PemKeyReader.readKeyPair(
          key.getPrivateKeyPemPath() == null ? null : Path.of(key.getPrivateKeyPemPath()),
          key.getPublicKeyPemPath() == null ? null : Path.of(key.getPublicKeyPemPath()));
      validateKeyPair(name, pair);
      keys.put(purpose, List.of(new SigningKey(new KeyId(purpose, 1),
          algorithm.asymmetric(pair.getPublic(), pair.getPrivate()))));
      fingerprints.put(purpose, fingerprint(pair.getPublic().getEncoded()));
    }
    ensureDistinctFingerprints();
  }

  @Override
  public synchronized SigningKey current(final TokenPurpose purpose) {
    final List<SigningKey> versions = keys.get(purpose);
    if (versions == null || versions.isEmpty()) {
      throw new IllegalStateException("No signing key loaded for " + purpose.claimValue());
    }
    return versions.get(versions.size() - 1);
  }

  @Override
  public synchronized Optional<SigningKey> find(final KeyId id) {
    return keys.getOrDefault(id.purpose(), List.of()).stream()
        .filter(k -> k.id().equals(id))
        .findFirst();
  }

  /**
   * Rotates a purpose to a new HMAC secret.
   *
   * @param purpose purpose to rotate
   * @param secret  new secret, subject to the same strength rules as configured ones
   * @return the new current key
   * @throws ConfigurationException when the secret is weak, reused, or the store is not HMAC
   */
  public SigningKey rotate(final TokenPurpose purpose, final String secret) {
    if (!algorithm.isHmac()) {
      throw new ConfigurationException(algorithm + " keys rotate with a key pair, not a secret");
    }
    validator.validateSecret(settingName(purpose) + ".secret", secret);
    final byte[] material = secret.getBytes(StandardCharsets.UTF_8);
    return install(purpose, fingerprint(material), () -> algorithm.hmac(material));
  }

  /**
   * Rotates a purpose to a new RSA or EC key pair.
   */
  public SigningKey rotate(final TokenPurpose purpose, final KeyPair pair) {
    if (algorithm.isHmac()) {
      throw new ConfigurationException(algorithm + " keys rotate with a secret, not a key pair");
    }
    validateKeyPair(settingName(purpose), pair);
    return install(purpose, fingerprint(pair.getPublic().getEncoded()),
        () -> algorithm.asymmetric(pair.getPublic(), pair.getPrivate()));
  }

  private SigningKey install(final TokenPurpose purpose,
                             final String fingerprint,
                             final Supplier<Algorithm> factory) {
    final SigningKey installed;
    synchronized (this) {
      for (Map.Entry<TokenPurpose, String> entry : fingerprints.entrySet()) {
        if (entry.getValue().equals(fingerprint)) {
          throw new ConfigurationException(entry.getKey() == purpose
              ? "New " + purpose.claimValue() + " key must differ from the current one"
              : "New " + purpose.claimValue() + " key is already used for " + entry.getKey().claimValue());
        }
      }
      final List<SigningKey> versions = new ArrayList<>(keys.get(purpose));
      final int version = versions.get(versions.size() - 1).id().version() + 1;
      installed = new SigningKey(new KeyId(purpose, version), factory.get());
      versions.add(installed);
      keys.put(purpose, retain(versions));
      fingerprints.put(purpose, fingerprint);
    }
    log.info("Rotated {} signing key to version {}", purpose.claimValue(), installed.id().version());
    events.event(SecurityEventType.SECRET_ROTATED, Severity.MEDIUM)
        .detail("purpose", purpose.claimValue())
        .detail("version", installed.id().version())
        .publish();
    return installed;
  }

  private List<SigningKey> retain(final List<SigningKey> versions) {
    final int from = Math.max(0, versions.size() - retainedVersions);
    return List.copyOf(versions.subList(from, versions.size()));
  }

  private void validateKeyPair(final String name, final KeyPair pair) {
    final PublicKey publicKey = pair.getPublic();
    switch (algorithm.family()) {
      case RSA -> {
        if (!(publicKey instanceof RSAKey rsa)) {
          throw new ConfigurationException(name + " must be an RSA key for " + algorithm);
        }
        validator.validateRsaKey(name, rsa);
      }
      case EC -> {
        if (!(publicKey instanceof ECKey ec)) {
          throw new ConfigurationException(name + " must be an EC key for " + algorithm);
        }
        final int bits = ec.getParams().getCurve().getField().getFieldSize();
        if (bits != algorithm.curveBits()) {
          throw new ConfigurationException(
              name + " uses a " + bits + "-bit curve but " + algorithm + " needs " + algorithm.curveBits());
        }
      }
      default -> throw new ConfigurationException(algorithm + " does not use key pairs");
    }
  }

  private void ensureDistinctFingerprints() {
    if (fingerprints.values().stream().distinct().count() != fingerprints.size()) {
      throw new ConfigurationException("Each token purpose must use its own key pair");
    }
  }

  private static String settingName(final TokenPurpose purpose) {
    return switch (purpose) {
      case ACCESS -> "secrets.access";
      case REFRESH -> "secrets.refresh";
      case EMAIL_VERIFICATION -> "secrets.emailVerification";
      case PASSWORD_RESET -> "secrets.passwordReset";
    };
  }

  private static String fingerprint(final byte[] material) {
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256").digest(material);
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
