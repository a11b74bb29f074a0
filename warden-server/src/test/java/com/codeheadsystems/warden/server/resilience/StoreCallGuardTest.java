package com.codeheadsystems.warden.server.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.warden.model.SessionEndReason;
import com.codeheadsystems.warden.server.MutableClock;
import com.codeheadsystems.warden.server.metrics.SecurityMetrics;
import com.codeheadsystems.warden.server.store.RevocationRegistry;
import com.codeheadsystems.warden.server.store.SessionRegistry;
import com.codeheadsystems.warden.server.store.StoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StoreCallGuardTest {

  @Mock private SessionRegistry sessions;
  @Mock private RevocationRegistry revocations;

  private ExecutorService executor;
  private MetricRegistry metricRegistry;
  private OutageTracker tracker;
  private StoreCallGuard guard;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    metricRegistry = new MetricRegistry();
    tracker = new OutageTracker("session", 2, MutableClock.at("2026-03-01T12:00:00Z"));
    guard = new StoreCallGuard("session", Duration.ofMillis(200), executor, tracker,
        new SecurityMetrics(metricRegistry));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void call_returnsResultAndRecordsSuccess() {
    tracker.recordFailure("find", null);

    assertThat(guard.call("countActive", () -> 4)).isEqualTo(4);
    assertThat(tracker.consecutiveFailures()).isZero();
  }

  @Test
  void call_slowStore_timesOut() {
    final CountDownLatch never = new CountDownLatch(1);

    assertThatThrownBy(() -> guard.call("isActive", () -> never.await(10, TimeUnit.SECONDS)))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessageContaining("timed out after 200ms");
    assertThat(metricRegistry.meter("warden.store.session.timeouts").getCount()).isEqualTo(1);
    assertThat(tracker.consecutiveFailures()).isEqualTo(1);
  }

  @Test
  void call_failingStore_wrapsCause() {
    final IllegalStateException cause = new IllegalStateException("connection reset");

    assertThatThrownBy(() -> guard.call("find", () -> {
      throw cause;
    }))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessage("session store find failed")
        .hasCause(cause);
    assertThat(metricRegistry.meter("warden.store.session.failures").getCount()).isEqualTo(1);
  }

  @Test
  void call_rejectedSubmission_isUnavailable() {
    executor.shutdownNow();

    assertThatThrownBy(() -> guard.call("find", () -> 1))
        .isInstanceOf(StoreUnavailableException.class);
  }

  @Test
  void guardedSessionRegistry_routesThroughGuard() {
    final GuardedSessionRegistry guarded = new GuardedSessionRegistry(sessions, guard);
    when(sessions.deactivateAll("user-alice", SessionEndReason.REVOKED)).thenReturn(2);
    doThrow(new IllegalStateException("down")).when(sessions).touch(anyString());

    assertThat(guarded.deactivateAll("user-alice", SessionEndReason.REVOKED)).isEqualTo(2);
    assertThatThrownBy(() -> guarded.touch("s1")).isInstanceOf(StoreUnavailableException.class);
    assertThatThrownBy(() -> guarded.touch("s1")).isInstanceOf(StoreUnavailableException.class);
    assertThat(tracker.isSustainedOutage()).isTrue();
  }

  @Test
  void guardedRevocationRegistry_routesThroughGuard() {
    final GuardedRevocationRegistry guarded = new GuardedRevocationRegistry(revocations, guard);
    when(revocations.isRevoked("jti:1")).thenReturn(true);
    when(revocations.revoke("jti:2", Duration.ofMinutes(1), "logout")).thenThrow(new IllegalStateException("down"));

    assertThat(guarded.isRevoked("jti:1")).isTrue();
    assertThatThrownBy(() -> guarded.revoke("jti:2", Duration.ofMinutes(1), "logout"))
        .isInstanceOf(StoreUnavailableException.class);
    verify(revocations).isRevoked("jti:1");
  }
}
