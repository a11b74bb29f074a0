package com.codeheadsystems.warden.server.event;

import com.codeheadsystems.warden.model.SecurityEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Keeps the most recent events in memory, dropping the oldest once full.
 */
public class RecentSecurityEvents implements SecurityEventSink {

  private final int capacity;
  private final Deque<SecurityEvent> events;

  public RecentSecurityEvents(final int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1");
    }
    this.capacity = capacity;
    this.events = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  @Override
  public synchronized void publish(final SecurityEvent event) {
    Objects.requireNonNull(event, "event");
    if (events.size() == capacity) {
      events.removeFirst();
    }
    events.addLast(event);
  }

  /**
   * Newest first.
   */
  public List<SecurityEvent> recent(final int limit) {
    return select(e -> true, limit);
  }

  /**
   * Newest first, only events about the given identity.
   */
  public List<SecurityEvent> recentFor(final String identityId, final int limit) {
    return select(e -> identityId.equals(e.identityId()), limit);
  }

  public synchronized int size() {
    return events.size();
  }

  private synchronized List<SecurityEvent> select(final Predicate<SecurityEvent> filter, final int limit) {
    final List<SecurityEvent> result = new ArrayList<>();
    final Iterator<SecurityEvent> it = events.descendingIterator();
    while (it.hasNext() && result.size() < limit) {
      final SecurityEvent event = it.next();
      if (filter.test(event)) {
        result.add(event);
      }
    }
    return result;
  }
}
