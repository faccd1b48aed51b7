package io.intellixity.federa.cache;

import java.time.Duration;
import java.util.Set;

/**
 * Out-of-process cache shared by the nodes of a cluster. Accessed without local locks; the store's own
 * get/set atomicity is relied upon.
 * <p>
 * Implementations throw {@link CacheException} when the store is unreachable.
 */
public interface ExternalCacheTier extends AutoCloseable {
  /** Cached value or null on a miss. */
  Object get(String key);

  void set(String key, Object value, Duration ttl, Set<String> tags);

  /** Removes every entry stored with {@code tag}. */
  void invalidateByTag(String tag);

  @Override
  default void close() {}
}
