package com.codeheadsystems.warden.server.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.resilience.OutageTracker;
import com.codeheadsystems.warden.server.secret.SecretStore;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Unhealthy when a signing key is missing or a store is in a sustained outage. A store that failed
 * only a few times in a row is still reported healthy, since validation fails open around it.
 */
public class WardenHealthCheck extends HealthCheck {

  private final SecretStore secretStore;
  private final List<OutageTracker> trackers;

  public WardenHealthCheck(final SecretStore secretStore, final List<OutageTracker> trackers) {
    this.secretStore = secretStore;
    this.trackers = List.copyOf(trackers);
  }

  @Override
  protected Result check() {
    for (TokenPurpose purpose : TokenPurpose.values()) {
      try {
        secretStore.current(purpose);
      } catch (IllegalStateException e) {
        return Result.unhealthy("No signing key for %s", purpose.claimValue());
      }
    }
    final List<OutageTracker> down = trackers.stream().filter(OutageTracker::isSustainedOutage).toList();
    if (!down.isEmpty()) {
      return Result.unhealthy("store outage: %s", down.stream()
          .map(t -> t.storeName() + " (" + t.consecutiveFailures() + " failures since " + t.outageStarted() + ")")
          .collect(Collectors.joining(", ")));
    }
    final String degraded = trackers.stream()
        .filter(t -> t.consecutiveFailures() > 0)
        .map(OutageTracker::storeName)
        .collect(Collectors.joining(", "));
    return degraded.isEmpty()
        ? Result.healthy("signing keys loaded, stores reachable")
        : Result.healthy("signing keys loaded, intermittent failures: %s", degraded);
  }
}
