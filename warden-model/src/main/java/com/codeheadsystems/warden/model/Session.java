package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A logged-in session. The identity snapshot is what refresh re-issues access tokens from, so it is
 * kept after the session ends until the record is purged.
 *
 * @param sessionId    unique id, carried as {@code sid} in both tokens
 * @param identity     identity snapshot taken at issuance
 * @param audience     client surface
 * @param deviceId     device identifier, optional
 * @param ipAddress    client address, optional
 * @param userAgent    client user agent, optional
 * @param createdAt    when issued
 * @param lastActivity last successful validation
 * @param expiresAt    when the refresh token expires
 * @param active       false once ended
 * @param endReason    why it ended, null while active
 */
public record Session(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("identity") Identity identity,
    @JsonProperty("audience") Audience audience,
    @JsonProperty("deviceId") String deviceId,
    @JsonProperty("ipAddress") String ipAddress,
    @JsonProperty("userAgent") String userAgent,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("lastActivity") Instant lastActivity,
    @JsonProperty("expiresAt") Instant expiresAt,
    @JsonProperty("active") boolean active,
    @JsonProperty("endReason") SessionEndReason endReason) {

  public Session {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(lastActivity, "lastActivity");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public String identityId() {
    return identity.id();
  }

  public Session withLastActivity(final Instant when) {
    return new Session(sessionId, identity, audience, deviceId, ipAddress, userAgent, createdAt, when,
        expiresAt, active, endReason);
  }

  public Session ended(final SessionEndReason reason) {
    return new Session(sessionId, identity, audience, deviceId, ipAddress, userAgent, createdAt,
        lastActivity, expiresAt, false, reason);
  }

  /**
   * Active, not past its expiry and used within the idle ceiling.
   */
  public boolean isLive(final Instant now, final Duration idleCeiling) {
    return active
        && now.isBefore(expiresAt)
        && !now.isAfter(lastActivity.plus(idleCeiling));
  }
}
