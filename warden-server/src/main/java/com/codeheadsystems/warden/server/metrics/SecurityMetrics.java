package com.codeheadsystems.warden.server.metrics;

import static com.codahale.metrics.MetricRegistry.name;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.model.VerdictError;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Counters and timers for the session security manager, registered under {@code warden.*}.
 */
@Singleton
public class SecurityMetrics {

  private final MetricRegistry registry;
  private final Meter sessionsCreated;
  private final Meter sessionsEvicted;
  private final Meter sessionsRevoked;
  private final Meter tokensRefreshed;
  private final Meter refreshRejected;
  private final Meter tokensRevoked;
  private final Meter validationsPassed;
  private final Meter suspiciousActivity;
  private final Timer validationTimer;

  @Inject
  public SecurityMetrics(final MetricRegistry registry) {
    this.registry = registry;
    this.sessionsCreated = registry.meter("warden.sessions.created");
    this.sessionsEvicted = registry.meter("warden.sessions.evicted");
    this.sessionsRevoked = registry.meter("warden.sessions.revoked");
    this.tokensRefreshed = registry.meter("warden.tokens.refreshed");
    this.refreshRejected = registry.meter("warden.tokens.refresh-rejected");
    this.tokensRevoked = registry.meter("warden.tokens.revoked");
    this.validationsPassed = registry.meter("warden.validation.passed");
    this.suspiciousActivity = registry.meter("warden.validation.suspicious");
    this.validationTimer = registry.timer("warden.validation.time");
  }

  public Timer.Context timeValidation() {
    return validationTimer.time();
  }

  public void sessionCreated() {
    sessionsCreated.mark();
  }

  public void sessionsEvicted(final int count) {
    sessionsEvicted.mark(count);
  }

  public void sessionsRevoked(final int count) {
    sessionsRevoked.mark(count);
  }

  public void tokenIssued(final TokenPurpose purpose) {
    registry.meter(name("warden.tokens.issued", purpose.claimValue())).mark();
  }

  public void tokenRefreshed() {
    tokensRefreshed.mark();
  }

  public void refreshRejected() {
    refreshRejected.mark();
  }

  public void tokenRevoked() {
    tokensRevoked.mark();
  }

  public void validationPassed() {
    validationsPassed.mark();
  }

  public void validationFailed(final VerdictError error) {
    registry.meter(name("warden.validation.failed", error.name().toLowerCase(Locale.ROOT))).mark();
  }

  public void suspiciousActivity(final int warnings) {
    suspiciousActivity.mark(warnings);
  }

  public void storeTimeout(final String store) {
    registry.meter(name("warden.store", store, "timeouts")).mark();
  }

  public void storeFailure(final String store) {
    registry.meter(name("warden.store", store, "failures")).mark();
  }
}
