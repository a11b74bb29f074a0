package com.codeheadsystems.warden.server.resilience;

import com.codeheadsystems.warden.model.Session;
import com.codeheadsystems.warden.model.SessionEndReason;
import com.codeheadsystems.warden.server.store.SessionRegistry;
import java.util.List;
import java.util.Optional;

/**
 * Puts every call to a remote {@link SessionRegistry} behind a {@link StoreCallGuard}.
 */
public class GuardedSessionRegistry implements SessionRegistry {

  private final SessionRegistry delegate;
  private final StoreCallGuard guard;

  public GuardedSessionRegistry(final SessionRegistry delegate, final StoreCallGuard guard) {
    this.delegate = delegate;
    this.guard = guard;
  }

  @Override
  public List<Session> createWithinLimit(final Session session, final int maxSessions) {
    return guard.call("createWithinLimit", () -> delegate.createWithinLimit(session, maxSessions));
  }

  @Override
  public Optional<Session> find(final String sessionId) {
    return guard.call("find", () -> delegate.find(sessionId));
  }

  @Override
  public boolean isActive(final String sessionId) {
    return guard.call("isActive", () -> delegate.isActive(sessionId));
  }

  @Override
  public void touch(final String sessionId) {
    guard.run("touch", () -> delegate.touch(sessionId));
  }

  @Override
  public List<Session> listActive(final String identityId) {
    return guard.call("listActive", () -> delegate.listActive(identityId));
  }

  @Override
  public int countActive(final String identityId) {
    return guard.call("countActive", () -> delegate.countActive(identityId));
  }

  @Override
  public boolean deactivate(final String sessionId, final SessionEndReason reason) {
    return guard.call("deactivate", () -> delegate.deactivate(sessionId, reason));
  }

  @Override
  public int deactivateAll(final String identityId, final SessionEndReason reason) {
    return guard.call("deactivateAll", () -> delegate.deactivateAll(identityId, reason));
  }

  @Override
  public int sweep() {
    return guard.call("sweep", delegate::sweep);
  }
}
