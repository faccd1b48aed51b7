package io.intellixity.federa.plan;

import java.util.Objects;
import java.util.Set;

/**
 * Caching of one top-level field.
 *
 * @param key        explicit cache key, or {@code null} to derive it from {@code canonical} and the caller
 * @param ttlSeconds {@code null} for the engine default
 * @param invalidate execute, then purge {@code tags} instead of caching
 * @param canonical  variable-free text of the field, qualified by its parent type, used for derived keys
 */
public record CachePolicy(String key, Integer ttlSeconds, Set<String> tags, boolean invalidate, String canonical) {
  public CachePolicy {
    tags = Set.copyOf(tags == null ? Set.of() : tags);
    Objects.requireNonNull(canonical, "canonical");
  }
}
