package io.intellixity.federa.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/** A cached top-level field result and the tier it was read from. */
public record CacheEntry(String key, Duration ttl, Set<String> tags, Object value, Tier tier) {
  public enum Tier { LOCAL, EXTERNAL }

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(ttl, "ttl");
    Objects.requireNonNull(tier, "tier");
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }
}
