package com.codeheadsystems.warden.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolved settings for calls into the session and revocation stores.
 *
 * @param callTimeout               a store call taking longer than this counts as a failure
 * @param strictMode                refuse tokens instead of failing open when the session store is down
 * @param revocationSweepInterval   how often expired revocation entries are purged
 * @param sustainedFailureThreshold consecutive failures after which an outage is reported as sustained
 */
public record StoreSettings(
    Duration callTimeout,
    boolean strictMode,
    Duration revocationSweepInterval,
    int sustainedFailureThreshold) {

  public StoreSettings {
    Objects.requireNonNull(callTimeout, "callTimeout");
    Objects.requireNonNull(revocationSweepInterval, "revocationSweepInterval");
    if (sustainedFailureThreshold < 1) {
      throw new ConfigurationException("sustainedFailureThreshold must be at least 1");
    }
  }

  public static StoreSettings defaults() {
    return new StoreSettings(Duration.ofSeconds(2), false, Duration.ofMinutes(1), 5);
  }

  public StoreSettings withStrictMode(final boolean strict) {
    return new StoreSettings(callTimeout, strict, revocationSweepInterval, sustainedFailureThreshold);
  }

  public StoreSettings withCallTimeout(final Duration timeout) {
    return new StoreSettings(timeout, strictMode, revocationSweepInterval, sustainedFailureThreshold);
  }
}
