package io.intellixity.federa.sdl;

import io.intellixity.federa.catalog.Catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog built from every data source that loaded cleanly, plus the failure of each data source that
 * did not.
 */
public record CatalogLoadResult(Catalog catalog, Map<String, SchemaDefinitionException> failures) {
  public CatalogLoadResult {
    Objects.requireNonNull(catalog, "catalog");
    failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  public boolean complete() { return failures.isEmpty(); }

  public SchemaDefinitionException failure(String dataSource) { return failures.get(dataSource); }

  /** Returns the catalog, or throws the first failure when any data source was rejected. */
  public Catalog orThrow() {
    if (!failures.isEmpty()) throw failures.values().iterator().next();
    return catalog;
  }
}
