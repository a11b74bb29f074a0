package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.model.TokenPurpose;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Signing keys per token purpose plus the strength policy they must satisfy.
 */
public class SecretsConfiguration {

  @Valid
  @NotNull
  private KeyConfiguration access = new KeyConfiguration();

  @Valid
  @NotNull
  private KeyConfiguration refresh = new KeyConfiguration();

  @Valid
  @NotNull
  private KeyConfiguration emailVerification = new KeyConfiguration();

  @Valid
  @NotNull
  private KeyConfiguration passwordReset = new KeyConfiguration();

  /**
   * Minimum HMAC secret length in bytes.
   */
  @Min(16)
  private int minimumLength = 32;

  /**
   * Raises the minimum HMAC secret length to 64 bytes.
   */
  private boolean highSecurity = false;

  /**
   * Key versions kept per purpose after rotation, current one included.
   */
  @Min(1)
  private int retainedVersions = 2;

  public KeyConfiguration forPurpose(final TokenPurpose purpose) {
    return switch (purpose) {
      case ACCESS -> access;
      case REFRESH -> refresh;
      case EMAIL_VERIFICATION -> emailVerification;
      case PASSWORD_RESET -> passwordReset;
    };
  }

  public int effectiveMinimumLength() {
    return highSecurity ? Math.max(64, minimumLength) : minimumLength;
  }

  @JsonProperty
  public KeyConfiguration getAccess() {
    return access;
  }

  @JsonProperty
  public void setAccess(KeyConfiguration access) {
    this.access = access;
  }

  @JsonProperty
  public KeyConfiguration getRefresh() {
    return refresh;
  }

  @JsonProperty
  public void setRefresh(KeyConfiguration refresh) {
    this.refresh = refresh;
  }

  @JsonProperty
  public KeyConfiguration getEmailVerification() {
    return emailVerification;
  }

  @JsonProperty
  public void setEmailVerification(KeyConfiguration emailVerification) {
    this.emailVerification = emailVerification;
  }

  @JsonProperty
  public KeyConfiguration getPasswordReset() {
    return passwordReset;
  }

  @JsonProperty
  public void setPasswordReset(KeyConfiguration passwordReset) {
    this.passwordReset = passwordReset;
  }

  @JsonProperty
  public int getMinimumLength() {
    return minimumLength;
  }

  @JsonProperty
  public void setMinimumLength(int minimumLength) {
    this.minimumLength = minimumLength;
  }

  @JsonProperty
  public boolean isHighSecurity() {
    return highSecurity;
  }

  @JsonProperty
  public void setHighSecurity(boolean highSecurity) {
    this.highSecurity = highSecurity;
  }

  @JsonProperty
  public int getRetainedVersions() {
    return retainedVersions;
  }

  @JsonProperty
  public void setRetainedVersions(int retainedVersions) {
    this.retainedVersions = retainedVersions;
  }
}
