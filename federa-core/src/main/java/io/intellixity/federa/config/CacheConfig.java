package io.intellixity.federa.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheConfig(boolean enabled,
                          @JsonProperty("local_max_entries") int localMaxEntries,
                          @JsonProperty("default_ttl_seconds") int defaultTtlSeconds,
                          @JsonProperty("idle_millis") long idleMillis) {
  public static final CacheConfig DEFAULT = new CacheConfig(true, 10_000, 60, 0);

  public CacheConfig {
    if (localMaxEntries <= 0) localMaxEntries = 10_000;
    if (defaultTtlSeconds <= 0) defaultTtlSeconds = 60;
    if (idleMillis < 0) throw new IllegalArgumentException("idle_millis must be >= 0");
  }
}
