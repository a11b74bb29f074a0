package com.codeheadsystems.warden.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolved session settings.
 *
 * @param maxConcurrentSessions live sessions allowed per identity
 * @param idleTimeout           sessions unused for longer than this are no longer live
 * @param sweepInterval         how often idle sessions are swept
 */
public record SessionSettings(int maxConcurrentSessions, Duration idleTimeout, Duration sweepInterval) {

  public SessionSettings {
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(sweepInterval, "sweepInterval");
    if (maxConcurrentSessions < 1) {
      throw new ConfigurationException("maxConcurrentSessions must be at least 1");
    }
  }

  public static SessionSettings defaults() {
    return new SessionSettings(5, Duration.ofHours(24), Duration.ofHours(1));
  }

  public SessionSettings withMaxConcurrentSessions(final int max) {
    return new SessionSettings(max, idleTimeout, sweepInterval);
  }
}
