package com.codeheadsystems.warden.server.store;

import java.time.Instant;

/**
 * @param key       revocation key, see {@link RevocationKeys}
 * @param reason    why it was revoked
 * @param revokedAt when
 * @param expiresAt when the entry may be forgotten; the token is dead on its own by then
 */
public record RevocationEntry(String key, String reason, Instant revokedAt, Instant expiresAt) {

  public boolean isExpired(final Instant now) {
    return !now.isBefore(expiresAt);
  }
}
