package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.model.Session;
import com.codeheadsystems.warden.model.SessionEndReason;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link SessionRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Reads are lock free. The create-and-evict step takes a lock striped by identity, so two logins of
 * the same identity cannot both slip under the limit while logins of different identities proceed in
 * parallel. Sessions are lost on restart.
 */
public class InMemorySessionRegistry implements SessionRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionRegistry.class);

  private static final int LOCK_STRIPES = 64;

  static final Comparator<Session> OLDEST_FIRST =
      Comparator.comparing(Session::createdAt).thenComparing(Session::sessionId);

  private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
  // Reverse index: identity id → session ids, kept in sync with sessions.
  private final ConcurrentHashMap<String, Set<String>> identityToSessions = new ConcurrentHashMap<>();
  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
  private final Clock clock;
  private final Duration idleTimeout;

  public InMemorySessionRegistry(final Clock clock, final Duration idleTimeout) {
    this.clock = clock;
    this.idleTimeout = idleTimeout;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  @Override
  public List<Session> createWithinLimit(final Session session, final int maxSessions) {
    Objects.requireNonNull(session, "session");
    if (maxSessions < 1) {
      throw new IllegalArgumentException("maxSessions must be at least 1");
    }
    final ReentrantLock lock = lockFor(session.identityId());
    lock.lock();
    try {
      // Victims come from the sessions that already exist, so the new one is never evicted.
      final List<Session> live = listActive(session.identityId());
      final List<Session> evicted = new ArrayList<>();
      for (int i = 0; i < live.size() - (maxSessions - 1); i++) {
        final Session oldest = live.get(i);
        if (deactivate(oldest.sessionId(), SessionEndReason.EVICTED)) {
          evicted.add(oldest);
        }
      }
      sessions.put(session.sessionId(), session);
      identityToSessions.computeIfAbsent(session.identityId(), k -> ConcurrentHashMap.newKeySet())
          .add(session.sessionId());
      log.debug("Created session {} ({} evicted)", session.sessionId(), evicted.size());
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<Session> find(final String sessionId) {
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public boolean isActive(final String sessionId) {
    final Session session = sessions.get(sessionId);
    return session != null && session.isLive(clock.instant(), idleTimeout);
  }

  @Override
  public void touch(final String sessionId) {
    final Instant now = clock.instant();
    sessions.computeIfPresent(sessionId,
        (id, s) -> s.isLive(now, idleTimeout) ? s.withLastActivity(now) : s);
  }

  @Override
  public List<Session> listActive(final String identityId) {
    final Set<String> ids = identityToSessions.get(identityId);
    if (ids == null) {
      return List.of();
    }
    final Instant now = clock.instant();
    return ids.stream()
        .map(sessions::get)
        .filter(Objects::nonNull)
        .filter(s -> s.isLive(now, idleTimeout))
        .sorted(OLDEST_FIRST)
        .toList();
  }

  @Override
  public int countActive(final String identityId) {
    return listActive(identityId).size();
  }

  @Override
  public boolean deactivate(final String sessionId, final SessionEndReason reason) {
    final boolean[] ended = {false};
    sessions.computeIfPresent(sessionId, (id, s) -> {
      if (!s.active()) {
        return s;
      }
      ended[0] = true;
      return s.ended(reason);
    });
    if (ended[0]) {
      log.debug("Ended session {} ({})", sessionId, reason);
    }
    return ended[0];
  }

  @Override
  public int deactivateAll(final String identityId, final SessionEndReason reason) {
    final Set<String> ids = identityToSessions.get(identityId);
    if (ids == null) {
      return 0;
    }
    int ended = 0;
    for (String sessionId : List.copyOf(ids)) {
      if (deactivate(sessionId, reason)) {
        ended++;
      }
    }
    log.debug("Ended {} session(s) for identity {}", ended, identityId);
    return ended;
  }

  @Override
  public int sweep() {
    final Instant now = clock.instant();
    int swept = 0;
    for (Session session : sessions.values()) {
      if (!now.isBefore(session.expiresAt())) {
        if (remove(session)) {
          swept++;
        }
      } else if (session.active() && !session.isLive(now, idleTimeout)) {
        if (deactivate(session.sessionId(), SessionEndReason.IDLE)) {
          swept++;
        }
      }
    }
    if (swept > 0) {
      log.debug("Swept {} session(s)", swept);
    }
    return swept;
  }

  int size() {
    return sessions.size();
  }

  private boolean remove(final Session session) {
    final ReentrantLock lock = lockFor(session.identityId());
    lock.lock();
    try {
      final Session current = sessions.get(session.sessionId());
      if (current == null || !sessions.remove(session.sessionId(), current)) {
        return false;
      }
      identityToSessions.computeIfPresent(session.identityId(), (k, ids) -> {
        ids.remove(session.sessionId());
        return ids.isEmpty() ? null : ids;
      });
      return true;
    } finally {
      lock.unlock();
    }
  }

  private ReentrantLock lockFor(final String identityId) {
    return locks[Math.floorMod(identityId.hashCode(), LOCK_STRIPES)];
  }
}
