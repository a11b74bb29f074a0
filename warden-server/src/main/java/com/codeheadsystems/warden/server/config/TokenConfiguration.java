package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.model.Audience;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Token lifetimes, issuer and audience names. Durations use the {@code <count><s|m|h|d>} form.
 */
public class TokenConfiguration {

  @NotEmpty
  private String issuer = "warden";

  /**
   * Signing algorithm. HMAC ({@code HS256}, {@code HS384}, {@code HS512}) uses the configured
   * secrets; {@code RS*} and {@code ES*} use PEM key files.
   */
  @NotEmpty
  private String algorithm = "HS256";

  @NotEmpty
  private String accessTtl = "15m";

  @NotEmpty
  private String refreshTtl = "30d";

  @NotEmpty
  private String emailVerificationTtl = "24h";

  @NotEmpty
  private String passwordResetTtl = "1h";

  @NotEmpty
  private String clockSkew = "30s";

  @NotEmpty
  private String refreshLowWaterMark = "5m";

  @NotEmpty
  private String webAudience = "web";

  @NotEmpty
  private String mobileAudience = "mobile";

  @NotEmpty
  private String adminAudience = "admin";

  /**
   * Resolves the text settings into typed ones.
   *
   * @return the resolved settings
   * @throws ConfigurationException when a duration is malformed or the lifetimes are inconsistent
   */
  public TokenSettings toSettings() {
    final Map<TokenPurpose, Duration> lifetimes = new EnumMap<>(TokenPurpose.class);
    lifetimes.put(TokenPurpose.ACCESS, TtlParser.parsePositive("tokens.accessTtl", accessTtl));
    lifetimes.put(TokenPurpose.REFRESH, TtlParser.parsePositive("tokens.refreshTtl", refreshTtl));
    lifetimes.put(TokenPurpose.EMAIL_VERIFICATION,
        TtlParser.parsePositive("tokens.emailVerificationTtl", emailVerificationTtl));
    lifetimes.put(TokenPurpose.PASSWORD_RESET,
        TtlParser.parsePositive("tokens.passwordResetTtl", passwordResetTtl));
    if (lifetimes.get(TokenPurpose.REFRESH).compareTo(lifetimes.get(TokenPurpose.ACCESS)) <= 0) {
      throw new ConfigurationException("tokens.refreshTtl must be longer than tokens.accessTtl");
    }
    final Map<Audience, String> audiences = new EnumMap<>(Audience.class);
    audiences.put(Audience.WEB, webAudience);
    audiences.put(Audience.MOBILE, mobileAudience);
    audiences.put(Audience.ADMIN, adminAudience);
    return new TokenSettings(issuer, lifetimes,
        TtlParser.parse("tokens.clockSkew", clockSkew),
        TtlParser.parse("tokens.refreshLowWaterMark", refreshLowWaterMark),
        audiences);
  }

  @JsonProperty
  public String getIssuer() {
    return issuer;
  }

  @JsonProperty
  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  @JsonProperty
  public String getAlgorithm() {
    return algorithm;
  }

  @JsonProperty
  public void setAlgorithm(String algorithm) {
    this.algorithm = algorithm;
  }

  @JsonProperty
  public String getAccessTtl() {
    return accessTtl;
  }

  @JsonProperty
  public void setAccessTtl(String accessTtl) {
    this.accessTtl = accessTtl;
  }

  @JsonProperty
  public String getRefreshTtl() {
    return refreshTtl;
  }

  @JsonProperty
  public void setRefreshTtl(String refreshTtl) {
    this.refreshTtl = refreshTtl;
  }

  @JsonProperty
  public String getEmailVerificationTtl() {
    return emailVerificationTtl;
  }

  @JsonProperty
  public void setEmailVerificationTtl(String emailVerificationTtl) {
    this.emailVerificationTtl = emailVerificationTtl;
  }

  @JsonProperty
  public String getPasswordResetTtl() {
    return passwordResetTtl;
  }

  @JsonProperty
  public void setPasswordResetTtl(String passwordResetTtl) {
    this.passwordResetTtl = passwordResetTtl;
  }

  @JsonProperty
  public String getClockSkew() {
    return clockSkew;
  }

  @JsonProperty
  public void setClockSkew(String clockSkew) {
    this.clockSkew = clockSkew;
  }

  @JsonProperty
  public String getRefreshLowWaterMark() {
    return refreshLowWaterMark;
  }

  @JsonProperty
  public void setRefreshLowWaterMark(String refreshLowWaterMark) {
    this.refreshLowWaterMark = refreshLowWaterMark;
  }

  @JsonProperty
  public String getWebAudience() {
    return webAudience;
  }

  @JsonProperty
  public void setWebAudience(String webAudience) {
    this.webAudience = webAudience;
  }

  @JsonProperty
  public String getMobileAudience() {
    return mobileAudience;
  }

  @JsonProperty
  public void setMobileAudience(String mobileAudience) {
    this.mobileAudience = mobileAudience;
  }

  @JsonProperty
  public String getAdminAudience() {
    return adminAudience;
  }

  @JsonProperty
  public void setAdminAudience(String adminAudience) {
    this.adminAudience = adminAudience;
  }
}
