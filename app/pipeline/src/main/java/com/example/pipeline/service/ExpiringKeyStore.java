/*
 * Where: pipeline service layer
 * What: in-memory key store whose entries expire after a fixed TTL
 * Why: dedup marks, execution mappings and cancellation marks share the same lifecycle rules
 */
package com.example.pipeline.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

final class ExpiringKeyStore<K, V> {

  private record Entry<V>(V value, Instant storedAt) {}

  private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  ExpiringKeyStore(Duration ttl, Clock clock) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.ttl = ttl;
    this.clock = clock;
  }

  /** Stores the value unless a live entry exists. Returns true when this call stored it. */
  boolean putIfAbsent(K key, V value) {
    final Instant now = clock.instant();
    final AtomicBoolean stored = new AtomicBoolean(false);
    entries.compute(
        key,
        (ignored, existing) -> {
          if (existing != null && !isExpired(existing, now)) {
            return existing;
          }
          stored.set(true);
          return new Entry<>(value, now);
        });
    if (stored.get()) {
      evictExpired(now);
    }
    return stored.get();
  }

  void put(K key, V value) {
    final Instant now = clock.instant();
    entries.put(key, new Entry<>(value, now));
    evictExpired(now);
  }

  Optional<V> get(K key) {
    final Entry<V> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (isExpired(entry, clock.instant())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  Optional<V> remove(K key) {
    final Entry<V> entry = entries.remove(key);
    if (entry == null || isExpired(entry, clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  int size() {
    return entries.size();
  }

  // runs on every insert; no background sweeper
  private void evictExpired(Instant now) {
    entries.values().removeIf(entry -> isExpired(entry, now));
  }

  private boolean isExpired(Entry<V> entry, Instant now) {
    return !now.isBefore(entry.storedAt().plus(ttl));
  }
}
