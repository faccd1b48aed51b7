package io.intellixity.federa.cache;

import java.time.Duration;
import java.util.*;
import java.util.function.LongSupplier;

/**
 * In-process tier: synchronized LRU with per-entry TTL, optional idle expiry and a tag index.
 * <p>
 * LRU eviction uses an access-order {@link LinkedHashMap}; TTL is expire-after-write and idle is
 * expire-after-access.
 */
public final class LocalCacheTier {
  private final int maxEntries;
  private final long idleMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<String, Entry> map = new LinkedHashMap<>(16, 0.75f, true);
  private final Map<String, Set<String>> keysByTag = new HashMap<>();

  private static final class Entry {
    final Object value;
    final Set<String> tags;
    final long ttlMillis;
    final long writeAt;
    long accessAt;

    Entry(Object value, Set<String> tags, long ttlMillis, long now) {
      this.value = value;
      this.tags = tags;
      this.ttlMillis = ttlMillis;
      this.writeAt = now;
      this.accessAt = now;
    }
  }

  public LocalCacheTier(int maxEntries, long idleMillis) {
    this(maxEntries, idleMillis, System::currentTimeMillis);
  }

  public LocalCacheTier(int maxEntries, long idleMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  /** Cached entry or null when absent or expired. */
  public synchronized CacheEntry get(String key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    Entry e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, now)) {
      remove(key);
      return null;
    }
    e.accessAt = now;
    return new CacheEntry(key, Duration.ofMillis(e.ttlMillis), e.tags, e.value, CacheEntry.Tier.LOCAL);
  }

  public synchronized void put(String key, Object value, Duration ttl, Set<String> tags) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(ttl, "ttl");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    remove(key);
    Set<String> t = tags == null ? Set.of() : Set.copyOf(tags);
    map.put(key, new Entry(value, t, ttl.toMillis(), now));
    for (String tag : t) keysByTag.computeIfAbsent(tag, k -> new HashSet<>()).add(key);
    evictIfNeeded();
  }

  /** Removes every entry carrying {@code tag}; returns how many were removed. */
  public synchronized int invalidateByTag(String tag) {
    Set<String> keys = keysByTag.remove(tag);
    if (keys == null) return 0;
    int n = 0;
    for (String k : List.copyOf(keys)) {
      if (remove(k)) n++;
    }
    return n;
  }

  public synchronized void clear() {
    map.clear();
    keysByTag.clear();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private boolean isExpired(Entry e, long now) {
    if (e.ttlMillis > 0 && (now - e.writeAt) >= e.ttlMillis) return true;
    return idleMillis > 0 && (now - e.accessAt) >= idleMillis;
  }

  private boolean remove(String key) {
    Entry e = map.remove(key);
    if (e == null) return false;
    for (String tag : e.tags) {
      Set<String> keys = keysByTag.get(tag);
      if (keys == null) continue;
      keys.remove(key);
      if (keys.isEmpty()) keysByTag.remove(tag);
    }
    return true;
  }

  private void pruneExpired(long now) {
    if (map.isEmpty()) return;
    List<String> expired = new ArrayList<>();
    for (Map.Entry<String, Entry> me : map.entrySet()) {
      if (isExpired(me.getValue(), now)) expired.add(me.getKey());
    }
    for (String k : expired) remove(k);
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<String> it = map.keySet().iterator();
      if (!it.hasNext()) return;
      remove(it.next());
    }
  }
}
