/*
 * どこで: Common キャッシュ
 * 何を: 期限付きのインメモリ key-value ストアと prefix 単位の一括削除を提供する
 * なぜ: 下流読み取りを短時間だけ再利用し、更新時にはまとめて捨てられるようにするため
 */
package com.dealdesk.common.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local cache whose entries expire at an absolute instant.
 *
 * <p>Reads past expiry behave as a miss and evict the entry. The cache is an acceleration layer
 * only; callers must not rely on it for correctness.
 */
public class TtlCache<V> {

  private final ConcurrentMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public TtlCache(Clock clock) {
    this.clock = clock;
  }

  public Optional<V> get(String key) {
    final CacheEntry<V> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      // 同じキーへ新しい値が入っていた場合に消さないよう、読んだエントリだけを外す
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  /**
   * Stores a value. A {@code null} ttl keeps the entry until it is deleted explicitly.
   */
  public void set(String key, V value, Duration ttl) {
    final Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
    entries.put(key, new CacheEntry<>(value, expiresAt));
  }

  public void delete(String key) {
    entries.remove(key);
  }

  public int deleteByPrefix(String prefix) {
    int removed = 0;
    for (String key : entries.keySet()) {
      if (key.startsWith(prefix) && entries.remove(key) != null) {
        removed++;
      }
    }
    return removed;
  }

  public int size() {
    return entries.size();
  }

  record CacheEntry<V>(V value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }
}
