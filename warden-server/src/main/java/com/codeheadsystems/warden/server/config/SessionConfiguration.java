package com.codeheadsystems.warden.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

public class SessionConfiguration {

  @Min(1)
  private int maxConcurrentSessions = 5;

  @NotEmpty
  private String idleTimeout = "24h";

  @NotEmpty
  private String sweepInterval = "1h";

  public SessionSettings toSettings() {
    return new SessionSettings(maxConcurrentSessions,
        TtlParser.parsePositive("sessions.idleTimeout", idleTimeout),
        TtlParser.parsePositive("sessions.sweepInterval", sweepInterval));
  }

  @JsonProperty
  public int getMaxConcurrentSessions() {
    return maxConcurrentSessions;
  }

  @JsonProperty
  public void setMaxConcurrentSessions(int maxConcurrentSessions) {
    this.maxConcurrentSessions = maxConcurrentSessions;
  }

  @JsonProperty
  public String getIdleTimeout() {
    return idleTimeout;
  }

  @JsonProperty
  public void setIdleTimeout(String idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  @JsonProperty
  public String getSweepInterval() {
    return sweepInterval;
  }

  @JsonProperty
  public void setSweepInterval(String sweepInterval) {
    this.sweepInterval = sweepInterval;
  }
}
