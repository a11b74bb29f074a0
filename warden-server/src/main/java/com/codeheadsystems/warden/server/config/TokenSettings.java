package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.model.Audience;
import com.codeheadsystems.warden.model.TokenPurpose;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved token settings.
 *
 * @param issuer              value of the {@code iss} claim
 * @param lifetimes           lifetime per purpose, every purpose present
 * @param clockSkew           tolerance applied to expiry and issue time checks
 * @param refreshLowWaterMark remaining access lifetime below which callers are told to refresh
 * @param audienceNames       {@code aud} claim value per audience, every audience present
 */
public record TokenSettings(
    String issuer,
    Map<TokenPurpose, Duration> lifetimes,
    Duration clockSkew,
    Duration refreshLowWaterMark,
    Map<Audience, String> audienceNames) {

  public TokenSettings {
    Objects.requireNonNull(issuer, "issuer");
    Objects.requireNonNull(clockSkew, "clockSkew");
    Objects.requireNonNull(refreshLowWaterMark, "refreshLowWaterMark");
    for (TokenPurpose purpose : TokenPurpose.values()) {
      if (!lifetimes.containsKey(purpose)) {
        throw new ConfigurationException("No lifetime configured for " + purpose.claimValue() + " tokens");
      }
    }
    for (Audience audience : Audience.values()) {
      if (!audienceNames.containsKey(audience)) {
        throw new ConfigurationException("No audience name configured for " + audience);
      }
    }
    if (audienceNames.values().stream().distinct().count() != audienceNames.size()) {
      throw new ConfigurationException("Audience names must be distinct");
    }
    lifetimes = Map.copyOf(lifetimes);
    audienceNames = Map.copyOf(audienceNames);
  }

  /**
   * Defaults: issuer {@code warden}, access 15m, refresh 30d, email verification 24h,
   * password reset 1h, 30s skew, refresh below 5m remaining.
   */
  public static TokenSettings defaults() {
    final Map<TokenPurpose, Duration> lifetimes = new EnumMap<>(TokenPurpose.class);
    lifetimes.put(TokenPurpose.ACCESS, Duration.ofMinutes(15));
    lifetimes.put(TokenPurpose.REFRESH, Duration.ofDays(30));
    lifetimes.put(TokenPurpose.EMAIL_VERIFICATION, Duration.ofHours(24));
    lifetimes.put(TokenPurpose.PASSWORD_RESET, Duration.ofHours(1));
    return new TokenSettings("warden", lifetimes, Duration.ofSeconds(30), Duration.ofMinutes(5),
        defaultAudienceNames());
  }

  static Map<Audience, String> defaultAudienceNames() {
    final Map<Audience, String> names = new EnumMap<>(Audience.class);
    names.put(Audience.WEB, "web");
    names.put(Audience.MOBILE, "mobile");
    names.put(Audience.ADMIN, "admin");
    return names;
  }

  public Duration lifetime(final TokenPurpose purpose) {
    return lifetimes.get(purpose);
  }

  /**
   * The longest configured lifetime, the upper bound on how long any revocation entry must live.
   */
  public Duration longestLifetime() {
    return lifetimes.values().stream().max(Duration::compareTo).orElseThrow();
  }

  public String audienceName(final Audience audience) {
    return audienceNames.get(audience);
  }

  public Optional<Audience> audienceFor(final String name) {
    return audienceNames.entrySet().stream()
        .filter(e -> e.getValue().equals(name))
        .map(Map.Entry::getKey)
        .findFirst();
  }

  public TokenSettings withClockSkew(final Duration skew) {
    return new TokenSettings(issuer, lifetimes, skew, refreshLowWaterMark, audienceNames);
  }

  public TokenSettings withLifetime(final TokenPurpose purpose, final Duration lifetime) {
    final Map<TokenPurpose, Duration> copy = new EnumMap<>(lifetimes);
    copy.put(purpose, lifetime);
    return new TokenSettings(issuer, copy, clockSkew, refreshLowWaterMark, audienceNames);
  }
}
