package com.codeheadsystems.warden.model;

/**
 * Why a session stopped being active.
 */
public enum SessionEndReason {
  /** Explicitly revoked, refresh is refused. */
  REVOKED,
  /** Pushed out by a newer session over the concurrency limit. */
  EVICTED,
  /** Replaced by a new session during refresh. */
  ROTATED,
  /** No activity within the idle ceiling. */
  IDLE,
  /** Refresh lifetime elapsed. */
  EXPIRED
}
