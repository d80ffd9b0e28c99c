/*
 * どこで: Common ストア実装
 * 何を: プロセス内メモリで TTL 付きキー/値を保持する
 * なぜ: ローカル起動とテストで外部ストア無しに台帳を動かすため
 */
package com.teamplatform.common.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryKeyValueStore implements KeyValueStore {

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(String key) {
    final Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, expiresAt(ttl)));
  }

  @Override
  public boolean putIfAbsent(String key, String value, Duration ttl) {
    final AtomicBoolean stored = new AtomicBoolean(false);
    final Instant now = clock.instant();
    // compute はキー単位で原子的に実行されるため、期限切れの置き換えも競合しない
    entries.compute(
        key,
        (ignored, current) -> {
          if (current != null && !current.isExpired(now)) {
            return current;
          }
          stored.set(true);
          return new Entry(value, expiresAt(ttl));
        });
    return stored.get();
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  @Override
  public Map<String, String> listByPrefix(String prefix, int limit) {
    final Instant now = clock.instant();
    final Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, Entry> candidate : entries.entrySet()) {
      if (result.size() >= limit) {
        break;
      }
      if (candidate.getKey().startsWith(prefix) && !candidate.getValue().isExpired(now)) {
        result.put(candidate.getKey(), candidate.getValue().value());
      }
    }
    return result;
  }

  private Instant expiresAt(Duration ttl) {
    if (ttl == null) {
      return null;
    }
    return clock.instant().plus(ttl);
  }

  private record Entry(String value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }
}
