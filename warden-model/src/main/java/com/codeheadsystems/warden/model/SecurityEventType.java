package com.codeheadsystems.warden.model;

public enum SecurityEventType {
  SESSION_CREATED,
  SESSION_EVICTED,
  SESSION_REVOKED,
  ALL_SESSIONS_REVOKED,
  TOKEN_REFRESHED,
  TOKEN_REVOKED,
  PURPOSE_TOKEN_ISSUED,
  REVOKED_TOKEN_PRESENTED,
  INVALID_TOKEN,
  SUSPICIOUS_ACTIVITY,
  STORE_UNAVAILABLE,
  SECRET_ROTATED
}
