package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Snapshot of an identity's sessions and recent security events.
 *
 * @param identityId     whose report this is
 * @param activeSessions currently live sessions
 * @param recentEvents   most recent events for the identity, newest first
 * @param riskScore      0 to 100, higher is riskier
 */
public record SecurityReport(
    @JsonProperty("identityId") String identityId,
    @JsonProperty("activeSessions") List<Session> activeSessions,
    @JsonProperty("recentEvents") List<SecurityEvent> recentEvents,
    @JsonProperty("riskScore") int riskScore) {

  public SecurityReport {
    activeSessions = List.copyOf(activeSessions);
    recentEvents = List.copyOf(recentEvents);
  }
}
