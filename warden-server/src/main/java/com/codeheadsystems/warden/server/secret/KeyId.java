package com.codeheadsystems.warden.server.secret;

import com.codeheadsystems.warden.model.TokenPurpose;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies one version of one purpose's signing key. Carried in the token header as
 * {@code kid = <purpose>:<version>}.
 *
 * @param purpose token purpose the key signs
 * @param version key version, starting at 1
 */
public record KeyId(TokenPurpose purpose, int version) {

  public KeyId {
    Objects.requireNonNull(purpose, "purpose");
    if (version < 1) {
      throw new IllegalArgumentException("version must be positive");
    }
  }

  /**
   * Parses a {@code kid} header value.
   *
   * @param value header value, may be null
   * @return the key id, empty when the value is absent or malformed
   */
  public static Optional<KeyId> parse(final String value) {
    if (value == null) {
      return Optional.empty();
    }
    final int colon = value.lastIndexOf(':');
    if (colon <= 0 || colon == value.length() - 1) {
      return Optional.empty();
    }
    final Optional<TokenPurpose> purpose = TokenPurpose.fromClaimValue(value.substring(0, colon));
    if (purpose.isEmpty()) {
      return Optional.empty();
    }
    try {
      final int version = Integer.parseInt(value.substring(colon + 1));
      return version < 1 ? Optional.empty() : Optional.of(new KeyId(purpose.get(), version));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  public String value() {
    return purpose.claimValue() + ":" + version;
  }
}
