package com.codeheadsystems.warden.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link RevocationRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired entries are ignored on read and physically removed by {@link #purgeExpired()}, which walks
 * the map in batches without blocking writers. Entries are lost on restart; deployments with more
 * than one instance need a shared implementation.
 */
@Singleton
public class InMemoryRevocationRegistry implements RevocationRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationRegistry.class);

  static final int PURGE_BATCH = 512;

  private final ConcurrentHashMap<String, RevocationEntry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  @Inject
  public InMemoryRevocationRegistry(final Clock clock) {
    this.clock = clock;
  }

  @Override
  public boolean revoke(final String key, final Duration ttl, final String reason) {
    if (ttl.isZero() || ttl.isNegative()) {
      log.debug("Skipping revocation of {}: already expired", key);
      return false;
    }
    final Instant now = clock.instant();
    final RevocationEntry candidate = new RevocationEntry(key, reason, now, now.plus(ttl));
    final boolean[] added = {false};
    entries.compute(key, (k, existing) -> {
      if (existing == null || existing.isExpired(now)) {
        added[0] = true;
        return candidate;
      }
      return existing;
    });
    if (added[0]) {
      log.debug("Revoked {} until {}", key, candidate.expiresAt());
    }
    return added[0];
  }

  @Override
  public boolean isRevoked(final String key) {
    final RevocationEntry entry = entries.get(key);
    if (entry == null) {
      return false;
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key, entry);
      return false;
    }
    return true;
  }

  @Override
  public boolean release(final String key) {
    final boolean removed = entries.remove(key) != null;
    if (removed) {
      log.debug("Released {}", key);
    }
    return removed;
  }

  @Override
  public int purgeExpired() {
    final Instant now = clock.instant();
    int removed = 0;
    final List<Map.Entry<String, RevocationEntry>> batch = new ArrayList<>(PURGE_BATCH);
    for (Map.Entry<String, RevocationEntry> entry : entries.entrySet()) {
      if (entry.getValue().isExpired(now)) {
        batch.add(Map.entry(entry.getKey(), entry.getValue()));
      }
      if (batch.size() == PURGE_BATCH) {
        removed += removeAll(batch);
      }
    }
    removed += removeAll(batch);
    if (removed > 0) {
      log.debug("Purged {} expired revocation entries", removed);
    }
    return removed;
  }

  private int removeAll(final List<Map.Entry<String, RevocationEntry>> batch) {
    int removed = 0;
    for (Map.Entry<String, RevocationEntry> entry : batch) {
      if (entries.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    batch.clear();
    return removed;
  }

  @Override
  public int size() {
    return entries.size();
  }
}
