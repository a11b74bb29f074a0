package com.codeheadsystems.warden.server.secret;

import com.codeheadsystems.warden.server.config.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAKey;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rejects signing secrets that are short, guessable or shared between purposes. Error messages name
 * the setting, never the secret.
 */
public class SecretStrengthValidator {

  static final List<String> DENY_LIST = List.of(
      "secret", "password", "passwd", "test", "demo", "example", "changeme", "qwerty", "admin", "default");

  static final int SEQUENCE_RUN = 4;

  static final int MINIMUM_RSA_BITS = 2048;

  private final int minimumLength;

  public SecretStrengthValidator(final int minimumLength) {
    this.minimumLength = minimumLength;
  }

  public int minimumLength() {
    return minimumLength;
  }

  /**
   * Checks a single HMAC secret.
   *
   * @param name   setting name for the error message
   * @param secret the secret
   * @throws ConfigurationException when the secret is too weak
   */
  public void validateSecret(final String name, final String secret) {
    if (secret == null || secret.isBlank()) {
      throw new ConfigurationException(name + " is required");
    }
    final int bytes = secret.getBytes(StandardCharsets.UTF_8).length;
    if (bytes < minimumLength) {
      throw new ConfigurationException(
          name + " must be at least " + minimumLength + " bytes long (got " + bytes + ")");
    }
    if (isSingleRepeatedCharacter(secret)) {
      throw new ConfigurationException(name + " must not be a single repeated character");
    }
    final String lower = secret.toLowerCase(Locale.ROOT);
    for (String word : DENY_LIST) {
      if (lower.contains(word)) {
        throw new ConfigurationException(name + " contains a well-known weak pattern");
      }
    }
    if (hasSequentialRun(secret, SEQUENCE_RUN)) {
      throw new ConfigurationException(name + " contains a sequential character run");
    }
  }

  /**
   * Checks that no two settings share the same secret.
   *
   * @param secretsByName secrets keyed by setting name
   */
  public void validateDistinct(final Map<String, String> secretsByName) {
    final Map<String, String> seen = new HashMap<>();
    secretsByName.forEach((name, secret) -> {
      final String previous = seen.putIfAbsent(secret, name);
      if (previous != null) {
        throw new ConfigurationException(previous + " and " + name + " must use different secrets");
      }
    });
  }

  public void validateRsaKey(final String name, final RSAKey key) {
    final int bits = key.getModulus().bitLength();
    if (bits < MINIMUM_RSA_BITS) {
      throw new ConfigurationException(
          name + " must be at least " + MINIMUM_RSA_BITS + " bits (got " + bits + ")");
    }
  }

  static boolean isSingleRepeatedCharacter(final String value) {
    return value.chars().distinct().count() == 1;
  }

  /**
   * True when the value holds {@code run} consecutive ascending or descending digits or letters,
   * like {@code 1234}, {@code dcba} or {@code WXYZ}.
   */
  static boolean hasSequentialRun(final String value, final int run) {
    int ascending = 1;
    int descending = 1;
    for (int i = 1; i < value.length(); i++) {
      final char prev = Character.toLowerCase(value.charAt(i - 1));
      final char curr = Character.toLowerCase(value.charAt(i));
      if (!sameClass(prev, curr)) {
        ascending = 1;
        descending = 1;
        continue;
      }
      ascending = curr == prev + 1 ? ascending + 1 : 1;
      descending = curr == prev - 1 ? descending + 1 : 1;
      if (ascending >= run || descending >= run) {
        return true;
      }
    }
    return false;
  }

  private static boolean sameClass(final char a, final char b) {
    return (isAsciiDigit(a) && isAsciiDigit(b)) || (isAsciiLetter(a) && isAsciiLetter(b));
  }

  private static boolean isAsciiDigit(final char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAsciiLetter(final char c) {
    return c >= 'a' && c <= 'z';
  }
}
