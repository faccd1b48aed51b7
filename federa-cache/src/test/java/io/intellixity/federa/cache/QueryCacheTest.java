package io.intellixity.federa.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class QueryCacheTest {
  private static final Duration TTL = Duration.ofSeconds(60);

  /** Map-backed external tier with a tag index and an on/off switch. */
  private static final class MapExternalTier implements ExternalCacheTier {
    final Map<String, Object> values = new ConcurrentHashMap<>();
    final Map<String, Set<String>> tags = new ConcurrentHashMap<>();
    volatile boolean down;
    final AtomicInteger gets = new AtomicInteger();

    @Override public Object get(String key) {
      gets.incrementAndGet();
      if (down) throw new CacheException("connection refused");
      return values.get(key);
    }

    @Override public void set(String key, Object value, Duration ttl, Set<String> t) {
      if (down) throw new CacheException("connection refused");
      values.put(key, value);
      for (String tag : t) tags.computeIfAbsent(tag, k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override public void invalidateByTag(String tag) {
      if (down) throw new CacheException("connection refused");
      Set<String> keys = tags.remove(tag);
      if (keys != null) keys.forEach(values::remove);
    }
  }

  private static QueryCache cache(ExternalCacheTier external) {
    return new QueryCache(new LocalCacheTier(100, 0), external);
  }

  @Test
  void missComputesAndPopulatesBothTiers() throws Exception {
    MapExternalTier ext = new MapExternalTier();
    QueryCache cache = cache(ext);
    AtomicInteger calls = new AtomicInteger();

    CacheEntry first = cache.getOrCompute("k", TTL, Set.of("orders"),
        () -> CompletableFuture.completedFuture("rows-" + calls.incrementAndGet())).get();
    CacheEntry second = cache.getOrCompute("k", TTL, Set.of("orders"),
        () -> CompletableFuture.completedFuture("rows-" + calls.incrementAndGet())).get();

    assertEquals("rows-1", first.value());
    assertEquals("rows-1", second.value());
    assertEquals(CacheEntry.Tier.LOCAL, second.tier());
    assertEquals(1, calls.get());
    assertEquals("rows-1", ext.values.get("k"));
  }

  @Test
  void externalHitFillsLocalTier() throws Exception {
    MapExternalTier ext = new MapExternalTier();
    ext.values.put("k", "from-redis");
    QueryCache cache = cache(ext);

    CacheEntry e = cache.getOrCompute("k", TTL, Set.of(),
        () -> { throw new AssertionError("must not compute"); }).get();

    assertEquals("from-redis", e.value());
    assertEquals(CacheEntry.Tier.EXTERNAL, e.tier());
    assertNotNull(cache.localTier().get("k"));
  }

  @Test
  void invalidationRemovesTaggedEntriesInBothTiers() throws Exception {
    MapExternalTier ext = new MapExternalTier();
    QueryCache cache = cache(ext);
    cache.getOrCompute("a", TTL, Set.of("orders"), () -> CompletableFuture.completedFuture(1)).get();
    cache.getOrCompute("b", TTL, Set.of("orders", "customers"), () -> CompletableFuture.completedFuture(2)).get();
    cache.getOrCompute("c", TTL, Set.of("customers"), () -> CompletableFuture.completedFuture(3)).get();

    cache.invalidate(List.of("orders"));

    assertNull(cache.localTier().get("a"));
    assertNull(cache.localTier().get("b"));
    assertNotNull(cache.localTier().get("c"));
    assertFalse(ext.values.containsKey("a"));
    assertFalse(ext.values.containsKey("b"));
    assertTrue(ext.values.containsKey("c"));
  }

  @Test
  void resultComputedAcrossAnInvalidationIsNotStored() throws Exception {
    QueryCache cache = cache(null);
    CompletableFuture<Object> gate = new CompletableFuture<>();

    CompletableFuture<CacheEntry> pending = cache.getOrCompute("k", TTL, Set.of("orders"), () -> gate);
    cache.invalidate(List.of("orders"));
    gate.complete("stale");

    assertEquals("stale", pending.get().value());
    assertNull(cache.localTier().get("k"));
  }

  @Test
  void concurrentRequestsForOneKeyComputeOnce() throws Exception {
    QueryCache cache = cache(new MapExternalTier());
    AtomicInteger calls = new AtomicInteger();
    CompletableFuture<Object> gate = new CompletableFuture<>();
    int n = 16;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      CountDownLatch start = new CountDownLatch(1);
      List<Future<CompletableFuture<CacheEntry>>> submitted = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        submitted.add(pool.submit(() -> {
          start.await();
          return cache.getOrCompute("k", TTL, Set.of(), () -> {
            calls.incrementAndGet();
            return gate;
          });
        }));
      }
      start.countDown();
      List<CompletableFuture<CacheEntry>> results = new ArrayList<>();
      for (Future<CompletableFuture<CacheEntry>> f : submitted) results.add(f.get(5, TimeUnit.SECONDS));

      gate.complete(List.of(Map.of("id", 1)));

      for (CompletableFuture<CacheEntry> r : results) {
        assertEquals(List.of(Map.of("id", 1)), r.get(5, TimeUnit.SECONDS).value());
      }
      assertEquals(1, calls.get());
      assertEquals(0, cache.inFlight());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void callersRacingACompletingFlightDoNotComputeAgain() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      for (int round = 0; round < 200; round++) {
        QueryCache cache = cache(null);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> submitted = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
          submitted.add(pool.submit(() -> {
            start.await();
            return cache.getOrCompute("k", TTL, Set.of(),
                () -> CompletableFuture.completedFuture("rows-" + calls.incrementAndGet())).get().value();
          }));
        }
        start.countDown();
        for (Future<Object> f : submitted) assertEquals("rows-1", f.get(5, TimeUnit.SECONDS));
        assertEquals(1, calls.get(), "round " + round);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void failedComputationIsNotCachedAndReleasesTheKey() {
    QueryCache cache = cache(null);

    CompletableFuture<CacheEntry> failed = cache.getOrCompute("k", TTL, Set.of(),
        () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));

    ExecutionException e = assertThrows(ExecutionException.class, failed::get);
    assertEquals("boom", e.getCause().getMessage());
    assertEquals(0, cache.inFlight());
    assertNull(cache.localTier().get("k"));
  }

  @Test
  void unreachableExternalTierDegradesToDirectExecution() throws Exception {
    MapExternalTier ext = new MapExternalTier();
    ext.down = true;
    QueryCache cache = cache(ext);

    CacheEntry e = cache.getOrCompute("k", TTL, Set.of("t"), () -> CompletableFuture.completedFuture("ok")).get();
    cache.invalidate(List.of("t"));

    assertEquals("ok", e.value());
    assertEquals(1, ext.gets.get());
  }
}
