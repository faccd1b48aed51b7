package io.intellixity.federa.cache;

import io.intellixity.federa.cache.CacheEntry.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Two-tier result cache with single-flight computation and tag invalidation.
 * <p>
 * Lookups check the local tier, then the external tier. A miss runs the computation once per key
 * and populates both tiers. Tag invalidation bumps the tag's generation first, so a computation that
 * started before the invalidation does not write its now-stale result. External tier failures are
 * logged and treated as misses.
 */
public final class QueryCache implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(QueryCache.class);

  private final LocalCacheTier local;
  private final ExternalCacheTier external;
  private final SingleFlight<String, CacheEntry> flights = new SingleFlight<>();
  private final Map<String, AtomicLong> tagGenerations = new ConcurrentHashMap<>();
  private final AtomicLong clearGeneration = new AtomicLong();

  public QueryCache(LocalCacheTier local) {
    this(local, null);
  }

  /** {@code external} may be null. */
  public QueryCache(LocalCacheTier local, ExternalCacheTier external) {
    this.local = Objects.requireNonNull(local, "local");
    this.external = external;
  }

  /** Cached value of {@code key} or the result of {@code compute}, which runs at most once concurrently. */
  public CompletableFuture<CacheEntry> getOrCompute(String key, Duration ttl, Set<String> tags,
                                                   Supplier<CompletableFuture<Object>> compute) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(ttl, "ttl");
    Objects.requireNonNull(compute, "compute");
    Set<String> t = tags == null ? Set.of() : Set.copyOf(tags);

    CacheEntry hit = local.get(key);
    if (hit != null) {
      log.debug("federa.cache hit tier=LOCAL key={}", key);
      return CompletableFuture.completedFuture(hit);
    }
    return flights.run(key, () -> load(key, ttl, t, compute));
  }

  private CompletableFuture<CacheEntry> load(String key, Duration ttl, Set<String> tags,
                                             Supplier<CompletableFuture<Object>> compute) {
    // a flight that finished after the first lookup has already stored its result
    CacheEntry hit = local.get(key);
    if (hit != null) return CompletableFuture.completedFuture(hit);
    CacheEntry fromExternal = externalGet(key, ttl, tags);
    if (fromExternal != null) {
      local.put(key, fromExternal.value(), ttl, tags);
      return CompletableFuture.completedFuture(fromExternal);
    }
    Map<String, Long> generations = generations(tags);
    long cleared = clearGeneration.get();
    log.debug("federa.cache miss key={}", key);
    return compute.get().thenApply(value -> {
      if (isCurrent(generations) && cleared == clearGeneration.get()) {
        local.put(key, value, ttl, tags);
        externalSet(key, value, ttl, tags);
      } else {
        log.debug("federa.cache stale result not stored key={}", key);
      }
      return new CacheEntry(key, ttl, tags, value, Tier.LOCAL);
    });
  }

  /** Removes entries carrying any of {@code tags} from both tiers. */
  public void invalidate(Collection<String> tags) {
    if (tags == null) return;
    for (String tag : new LinkedHashSet<>(tags)) {
      tagGenerations.computeIfAbsent(tag, k -> new AtomicLong()).incrementAndGet();
      int removed = local.invalidateByTag(tag);
      if (external != null) {
        try {
          external.invalidateByTag(tag);
        } catch (CacheException e) {
          log.warn("federa.cache external invalidation failed tag={} err={}", tag, e.getMessage());
        }
      }
      log.debug("federa.cache invalidated tag={} local_removed={}", tag, removed);
    }
  }

  /** Drops the local tier, e.g. after a schema reload. */
  public void clearLocal() {
    clearGeneration.incrementAndGet();
    local.clear();
  }

  public LocalCacheTier localTier() {
    return local;
  }

  public int inFlight() {
    return flights.size();
  }

  @Override
  public void close() throws Exception {
    if (external != null) external.close();
  }

  private CacheEntry externalGet(String key, Duration ttl, Set<String> tags) {
    if (external == null) return null;
    try {
      Object v = external.get(key);
      if (v == null) return null;
      log.debug("federa.cache hit tier=EXTERNAL key={}", key);
      return new CacheEntry(key, ttl, tags, v, Tier.EXTERNAL);
    } catch (CacheException e) {
      log.warn("federa.cache external get failed key={} err={}", key, e.getMessage());
      return null;
    }
  }

  private void externalSet(String key, Object value, Duration ttl, Set<String> tags) {
    if (external == null) return;
    try {
      external.set(key, value, ttl, tags);
    } catch (CacheException e) {
      log.warn("federa.cache external set failed key={} err={}", key, e.getMessage());
    }
  }

  private Map<String, Long> generations(Set<String> tags) {
    if (tags.isEmpty()) return Map.of();
    Map<String, Long> out = new HashMap<>();
    for (String tag : tags) out.put(tag, generation(tag));
    return out;
  }

  private boolean isCurrent(Map<String, Long> generations) {
    for (Map.Entry<String, Long> e : generations.entrySet()) {
      if (generation(e.getKey()) != e.getValue()) return false;
    }
    return true;
  }

  private long generation(String tag) {
    AtomicLong g = tagGenerations.get(tag);
    return g == null ? 0L : g.get();
  }
}
