package io.intellixity.federa.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class LocalCacheTierTest {
  private final AtomicLong now = new AtomicLong(1_000);

  @Test
  void expiresAfterWrite() {
    LocalCacheTier tier = new LocalCacheTier(10, 0, now::get);
    tier.put("k", "v", Duration.ofMillis(100), Set.of());

    now.addAndGet(99);
    assertEquals("v", tier.get("k").value());
    now.addAndGet(1);
    assertNull(tier.get("k"));
  }

  @Test
  void expiresWhenIdle() {
    LocalCacheTier tier = new LocalCacheTier(10, 50, now::get);
    tier.put("k", "v", Duration.ofSeconds(60), Set.of());

    now.addAndGet(40);
    assertNotNull(tier.get("k"));
    now.addAndGet(40);
    assertNotNull(tier.get("k"));
    now.addAndGet(50);
    assertNull(tier.get("k"));
  }

  @Test
  void evictsLeastRecentlyUsed() {
    LocalCacheTier tier = new LocalCacheTier(2, 0, now::get);
    tier.put("a", 1, Duration.ofSeconds(60), Set.of());
    tier.put("b", 2, Duration.ofSeconds(60), Set.of());
    tier.get("a");
    tier.put("c", 3, Duration.ofSeconds(60), Set.of());

    assertNotNull(tier.get("a"));
    assertNull(tier.get("b"));
    assertNotNull(tier.get("c"));
    assertEquals(2, tier.size());
  }

  @Test
  void invalidatesByTag() {
    LocalCacheTier tier = new LocalCacheTier(10, 0, now::get);
    tier.put("a", 1, Duration.ofSeconds(60), Set.of("orders", "customers"));
    tier.put("b", 2, Duration.ofSeconds(60), Set.of("orders"));
    tier.put("c", 3, Duration.ofSeconds(60), Set.of("products"));

    assertEquals(2, tier.invalidateByTag("orders"));
    assertNull(tier.get("a"));
    assertNull(tier.get("b"));
    assertNotNull(tier.get("c"));
    assertEquals(0, tier.invalidateByTag("customers"));
  }

  @Test
  void nullValuesAreCached() {
    LocalCacheTier tier = new LocalCacheTier(10, 0, now::get);
    tier.put("k", null, Duration.ofSeconds(60), Set.of());

    CacheEntry e = tier.get("k");
    assertNotNull(e);
    assertNull(e.value());
    assertEquals(CacheEntry.Tier.LOCAL, e.tier());
  }

  @Test
  void rejectsBadSettings() {
    assertThrows(IllegalArgumentException.class, () -> new LocalCacheTier(0, 0));
    assertThrows(IllegalArgumentException.class, () -> new LocalCacheTier(1, -1));
  }
}
