package com.codeheadsystems.warden.server.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows the health of one store. The first failure in a row is logged as a warning, a run of
 * {@code sustainedThreshold} or more as an error, and the first success afterwards as a recovery.
 */
public class OutageTracker {

  private static final Logger log = LoggerFactory.getLogger(OutageTracker.class);

  private final String storeName;
  private final int sustainedThreshold;
  private final Clock clock;
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private final AtomicReference<Instant> outageStarted = new AtomicReference<>();

  public OutageTracker(final String storeName, final int sustainedThreshold, final Clock clock) {
    this.storeName = storeName;
    this.sustainedThreshold = sustainedThreshold;
    this.clock = clock;
  }

  public void recordFailure(final String operation, final Throwable cause) {
    final int failures = consecutiveFailures.incrementAndGet();
    if (failures == 1) {
      outageStarted.set(clock.instant());
    }
    if (failures < sustainedThreshold) {
      log.warn("{} store {} failed ({} in a row): {}", storeName, operation, failures, describe(cause));
    } else {
      log.error("{} store unavailable since {}: {} failed ({} in a row): {}",
          storeName, outageStarted.get(), operation, failures, describe(cause));
    }
  }

  public void recordSuccess() {
    final int failures = consecutiveFailures.getAndSet(0);
    if (failures > 0) {
      log.info("{} store recovered after {} consecutive failure(s)", storeName, failures);
      outageStarted.set(null);
    }
  }

  public String storeName() {
    return storeName;
  }

  public int consecutiveFailures() {
    return consecutiveFailures.get();
  }

  public boolean isSustainedOutage() {
    return consecutiveFailures.get() >= sustainedThreshold;
  }

  public Instant outageStarted() {
    return outageStarted.get();
  }

  private static String describe(final Throwable cause) {
    return cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
