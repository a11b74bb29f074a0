package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.model.Session;
import com.codeheadsystems.warden.model.SessionEndReason;
import java.util.List;
import java.util.Optional;

/**
 * Tracks sessions per identity and enforces the concurrent session limit.
 * <p>
 * A session is live while it is active, before its expiry and used within the idle ceiling. Ended
 * sessions stay readable through {@link #find} until {@link #sweep()} removes them after expiry.
 * Every method may throw {@link StoreUnavailableException} when backed by a remote store.
 */
public interface SessionRegistry {

  /**
   * Adds a session and, in the same step, ends the oldest live sessions of that identity until no
   * more than {@code maxSessions} remain. The new session itself is never evicted. Concurrent calls for one identity never leave more than
   * {@code maxSessions} live sessions behind.
   *
   * @param session     new, active session
   * @param maxSessions live session limit per identity
   * @return the sessions that were evicted, oldest first
   */
  List<Session> createWithinLimit(Session session, int maxSessions);

  Optional<Session> find(String sessionId);

  /**
   * Whether the session is live right now. Unknown sessions are not.
   */
  boolean isActive(String sessionId);

  /**
   * Records activity on a live session. No-op for unknown or ended sessions.
   */
  void touch(String sessionId);

  /**
   * Live sessions of an identity, oldest first.
   */
  List<Session> listActive(String identityId);

  int countActive(String identityId);

  /**
   * Ends a session.
   *
   * @return true when the session was active before this call
   */
  boolean deactivate(String sessionId, SessionEndReason reason);

  /**
   * Ends every active session of an identity. Sessions created concurrently with this call may
   * survive it.
   *
   * @return number of sessions ended
   */
  int deactivateAll(String identityId, SessionEndReason reason);

  /**
   * Ends sessions that are no longer live and drops records past their expiry.
   *
   * @return number of sessions ended or removed
   */
  int sweep();
}
