package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * What a token may be used for. Each purpose is signed with its own secret, so a token minted for
 * one purpose never verifies as another.
 */
public enum TokenPurpose {
  ACCESS("access"),
  REFRESH("refresh"),
  EMAIL_VERIFICATION("email-verification"),
  PASSWORD_RESET("password-reset");

  private final String claimValue;

  TokenPurpose(final String claimValue) {
    this.claimValue = claimValue;
  }

  /**
   * Finds the purpose for the value carried in the {@code purpose} claim.
   *
   * @param value claim value, may be null
   * @return the purpose, empty when the value is unknown
   */
  public static Optional<TokenPurpose> fromClaimValue(final String value) {
    for (TokenPurpose purpose : values()) {
      if (purpose.claimValue.equals(value)) {
        return Optional.of(purpose);
      }
    }
    return Optional.empty();
  }

  @JsonValue
  public String claimValue() {
    return claimValue;
  }
}
