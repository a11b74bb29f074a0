package com.codeheadsystems.warden.server.resilience;

import com.codeheadsystems.warden.server.store.RevocationRegistry;
import java.time.Duration;

/**
 * Puts every call to a remote {@link RevocationRegistry} behind a {@link StoreCallGuard}.
 */
public class GuardedRevocationRegistry implements RevocationRegistry {

  private final RevocationRegistry delegate;
  private final StoreCallGuard guard;

  public GuardedRevocationRegistry(final RevocationRegistry delegate, final StoreCallGuard guard) {
    this.delegate = delegate;
    this.guard = guard;
  }

  @Override
  public boolean revoke(final String key, final Duration ttl, final String reason) {
    return guard.call("revoke", () -> delegate.revoke(key, ttl, reason));
  }

  @Override
  public boolean isRevoked(final String key) {
    return guard.call("isRevoked", () -> delegate.isRevoked(key));
  }

  @Override
  public boolean release(final String key) {
    return guard.call("release", () -> delegate.release(key));
  }

  @Override
  public int purgeExpired() {
    return guard.call("purgeExpired", delegate::purgeExpired);
  }

  @Override
  public int size() {
    return guard.call("size", delegate::size);
  }
}
