package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * The decoded payload of a token. Access tokens carry the full identity; refresh tokens only the
 * subject, session and device; purpose tokens only the subject and email.
 *
 * @param tokenId     unique token id ({@code jti})
 * @param identityId  subject ({@code sub})
 * @param email       optional email
 * @param role        role, null on refresh and purpose tokens
 * @param permissions permissions, empty on refresh and purpose tokens
 * @param sessionId   owning session, null on purpose tokens
 * @param purpose     what the token may be used for
 * @param audience    client surface the token is scoped to
 * @param deviceId    optional device binding
 * @param ipAddress   client address seen at issuance
 * @param userAgent   client user agent seen at issuance
 * @param issuer      issuer ({@code iss})
 * @param issuedAt    issue time, second precision
 * @param expiresAt   expiry time, second precision
 */
public record ClaimSet(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("identityId") String identityId,
    @JsonProperty("email") String email,
    @JsonProperty("role") Role role,
    @JsonProperty("permissions") Set<String> permissions,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("purpose") TokenPurpose purpose,
    @JsonProperty("audience") Audience audience,
    @JsonProperty("deviceId") String deviceId,
    @JsonProperty("ipAddress") String ipAddress,
    @JsonProperty("userAgent") String userAgent,
    @JsonProperty("issuer") String issuer,
    @JsonProperty("issuedAt") Instant issuedAt,
    @JsonProperty("expiresAt") Instant expiresAt) {

  public ClaimSet {
    Objects.requireNonNull(tokenId, "tokenId");
    Objects.requireNonNull(identityId, "identityId");
    Objects.requireNonNull(purpose, "purpose");
    Objects.requireNonNull(audience, "audience");
    Objects.requireNonNull(issuer, "issuer");
    Objects.requireNonNull(issuedAt, "issuedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String tokenId;
    private String identityId;
    private String email;
    private Role role;
    private Set<String> permissions = Set.of();
    private String sessionId;
    private TokenPurpose purpose;
    private Audience audience = Audience.WEB;
    private String deviceId;
    private String ipAddress;
    private String userAgent;
    private String issuer;
    private Instant issuedAt;
    private Instant expiresAt;

    public Builder tokenId(final String value) {
      this.tokenId = value;
      return this;
    }

    public Builder identityId(final String value) {
      this.identityId = value;
      return this;
    }

    public Builder email(final String value) {
      this.email = value;
      return this;
    }

    public Builder role(final Role value) {
      this.role = value;
      return this;
    }

    public Builder permissions(final Set<String> value) {
      this.permissions = value;
      return this;
    }

    public Builder sessionId(final String value) {
      this.sessionId = value;
      return this;
    }

    public Builder purpose(final TokenPurpose value) {
      this.purpose = value;
      return this;
    }

    public Builder audience(final Audience value) {
      this.audience = value;
      return this;
    }

    public Builder deviceId(final String value) {
      this.deviceId = value;
      return this;
    }

    public Builder ipAddress(final String value) {
      this.ipAddress = value;
      return this;
    }

    public Builder userAgent(final String value) {
      this.userAgent = value;
      return this;
    }

    public Builder issuer(final String value) {
      this.issuer = value;
      return this;
    }

    public Builder issuedAt(final Instant value) {
      this.issuedAt = value;
      return this;
    }

    public Builder expiresAt(final Instant value) {
      this.expiresAt = value;
      return this;
    }

    public ClaimSet build() {
      return new ClaimSet(tokenId, identityId, email, role, permissions, sessionId, purpose, audience,
          deviceId, ipAddress, userAgent, issuer, issuedAt, expiresAt);
    }
  }
}
