package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Something security relevant that happened. Never carries token or secret material.
 *
 * @param type       what happened
 * @param severity   how much it matters
 * @param identityId identity involved, optional
 * @param sessionId  session involved, optional
 * @param ipAddress  client address, optional
 * @param timestamp  when it happened
 * @param details    extra key/value detail, never null
 */
public record SecurityEvent(
    @JsonProperty("type") SecurityEventType type,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("identityId") String identityId,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("ipAddress") String ipAddress,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("details") Map<String, String> details) {

  public SecurityEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(timestamp, "timestamp");
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
