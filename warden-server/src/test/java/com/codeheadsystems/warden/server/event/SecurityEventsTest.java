package com.codeheadsystems.warden.server.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.warden.model.SecurityEvent;
import com.codeheadsystems.warden.model.SecurityEventType;
import com.codeheadsystems.warden.model.Severity;
import com.codeheadsystems.warden.server.MutableClock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SecurityEventsTest {

  private final MutableClock clock = MutableClock.at("2026-03-01T12:00:00Z");

  @Test
  void publisher_buildsEventWithTimestampAndDetails() {
    final RecentSecurityEvents recent = new RecentSecurityEvents(10);
    final SecurityEventPublisher publisher = new SecurityEventPublisher(recent, clock);

    publisher.event(SecurityEventType.SESSION_EVICTED, Severity.LOW)
        .identity("user-alice")
        .session("s1")
        .ip("203.0.113.7")
        .detail("limit", 3)
        .detail("ignored", null)
        .publish();

    final SecurityEvent event = recent.recent(1).get(0);
    assertThat(event.type()).isEqualTo(SecurityEventType.SESSION_EVICTED);
    assertThat(event.identityId()).isEqualTo("user-alice");
    assertThat(event.sessionId()).isEqualTo("s1");
    assertThat(event.ipAddress()).isEqualTo("203.0.113.7");
    assertThat(event.timestamp()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
    assertThat(event.details()).containsOnlyKeys("limit").containsEntry("limit", "3");
  }

  @Test
  void recent_isBoundedAndNewestFirst() {
    final RecentSecurityEvents recent = new RecentSecurityEvents(3);
    final SecurityEventPublisher publisher = new SecurityEventPublisher(recent, clock);
    for (int i = 0; i < 5; i++) {
      publisher.event(SecurityEventType.SESSION_CREATED, Severity.LOW)
          .identity(i % 2 == 0 ? "user-alice" : "user-bob")
          .session("s" + i)
          .publish();
    }

    assertThat(recent.size()).isEqualTo(3);
    assertThat(recent.recent(10)).extracting(SecurityEvent::sessionId).containsExactly("s4", "s3", "s2");
    assertThat(recent.recent(1)).extracting(SecurityEvent::sessionId).containsExactly("s4");
    assertThat(recent.recentFor("user-alice", 10)).extracting(SecurityEvent::sessionId).containsExactly("s4", "s2");
  }

  @Test
  void composite_failingSinkDoesNotStopOthers() {
    final SecurityEventSink broken = mock(SecurityEventSink.class);
    doThrow(new IllegalStateException("queue full")).when(broken).publish(any());
    final RecentSecurityEvents recent = new RecentSecurityEvents(10);
    final SecurityEventPublisher publisher = new SecurityEventPublisher(
        new CompositeSecurityEventSink(List.of(broken, new LoggingSecurityEventSink(), recent)), clock);

    publisher.event(SecurityEventType.REVOKED_TOKEN_PRESENTED, Severity.HIGH).identity("user-alice").publish();

    verify(broken).publish(any());
    assertThat(recent.size()).isEqualTo(1);
  }
}
