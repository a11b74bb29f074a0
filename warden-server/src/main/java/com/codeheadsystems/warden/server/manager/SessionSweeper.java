package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.server.config.SessionSettings;
import com.codeheadsystems.warden.server.config.StoreSettings;
import com.codeheadsystems.warden.server.store.RevocationRegistry;
import com.codeheadsystems.warden.server.store.SessionRegistry;
import com.codeheadsystems.warden.server.store.StoreUnavailableException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background thread that ends idle sessions and drops expired revocation entries.
 */
public class SessionSweeper {

  private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

  private final SessionRegistry sessions;
  private final RevocationRegistry revocations;
  private final ScheduledExecutorService sweeper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "warden-sweeper");
        t.setDaemon(true);
        return t;
      });

  public SessionSweeper(final SessionRegistry sessions, final RevocationRegistry revocations) {
    this.sessions = sessions;
    this.revocations = revocations;
  }

  /**
   * Schedules both sweeps at their configured intervals.
   */
  public void start(final SessionSettings sessionSettings, final StoreSettings storeSettings) {
    final long sessionMillis = sessionSettings.sweepInterval().toMillis();
    final long revocationMillis = storeSettings.revocationSweepInterval().toMillis();
    sweeper.scheduleAtFixedRate(this::sweepSessions, sessionMillis, sessionMillis, TimeUnit.MILLISECONDS);
    sweeper.scheduleAtFixedRate(this::sweepRevocations, revocationMillis, revocationMillis, TimeUnit.MILLISECONDS);
    log.info("Sweeping sessions every {} and revocations every {}",
        sessionSettings.sweepInterval(), storeSettings.revocationSweepInterval());
  }

  // A scheduled task that throws is never run again, so both sweeps log and carry on.
  int sweepSessions() {
    try {
      return sessions.sweep();
    } catch (StoreUnavailableException e) {
      log.warn("Session sweep skipped: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Session sweep failed", e);
    }
    return 0;
  }

  int sweepRevocations() {
    try {
      return revocations.purgeExpired();
    } catch (StoreUnavailableException e) {
      log.warn("Revocation sweep skipped: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Revocation sweep failed", e);
    }
    return 0;
  }

  public void shutdown() {
    sweeper.shutdownNow();
  }
}
