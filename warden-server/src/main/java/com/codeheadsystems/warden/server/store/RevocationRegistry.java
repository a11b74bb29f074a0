package com.codeheadsystems.warden.server.store;

import java.time.Duration;

/**
 * Revocation list. Entries expire on their own once the revoked token could no longer verify.
 */
public interface RevocationRegistry {

  /**
   * Records a revocation. Non-positive lifetimes are ignored, since such a token is already dead.
   *
   * @param key    revocation key
   * @param ttl    how long to remember it
   * @param reason why, for audit
   * @return true when this call added the entry, false when it was already present
   * @throws StoreUnavailableException when the store cannot be reached
   */
  boolean revoke(String key, Duration ttl, String reason);

  /**
   * @throws StoreUnavailableException when the store cannot be reached
   */
  boolean isRevoked(String key);

  /**
   * Removes an entry. Used to hand back a claim when the operation that made it could not finish.
   *
   * @return true when an entry was removed
   * @throws StoreUnavailableException when the store cannot be reached
   */
  boolean release(String key);

  /**
   * Drops entries whose lifetime has passed.
   *
   * @return number of entries removed
   */
  int purgeExpired();

  int size();
}
