package io.intellixity.federa.catalog;

import java.util.List;

/** Cache settings from {@code @cache}. A {@code null} ttl means the engine default. */
public record CacheSpec(Integer ttlSeconds, String key, List<String> tags) {
  public CacheSpec {
    tags = List.copyOf(tags == null ? List.of() : tags);
  }
}
