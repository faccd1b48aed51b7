package io.intellixity.federa.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engine settings. Missing or non-positive numbers fall back to the defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(@JsonProperty("default_limit") int defaultLimit,
                           @JsonProperty("worker_threads") int workerThreads,
                           @JsonProperty("request_timeout_millis") long requestTimeoutMillis,
                           CacheConfig cache,
                           Boolean introspection) {
  public static final int DEFAULT_LIMIT = 2000;

  public static final EngineConfig DEFAULT = new EngineConfig(DEFAULT_LIMIT, 0, 30_000, CacheConfig.DEFAULT, true);

  public EngineConfig {
    if (defaultLimit <= 0) defaultLimit = DEFAULT_LIMIT;
    if (workerThreads <= 0) workerThreads = Math.max(4, Runtime.getRuntime().availableProcessors());
    if (requestTimeoutMillis <= 0) requestTimeoutMillis = 30_000;
    if (cache == null) cache = CacheConfig.DEFAULT;
    if (introspection == null) introspection = true;
  }

  public EngineConfig withCache(CacheConfig newCache) {
    return new EngineConfig(defaultLimit, workerThreads, requestTimeoutMillis, newCache, introspection);
  }

  public EngineConfig withRequestTimeoutMillis(long millis) {
    return new EngineConfig(defaultLimit, workerThreads, millis, cache, introspection);
  }
}
