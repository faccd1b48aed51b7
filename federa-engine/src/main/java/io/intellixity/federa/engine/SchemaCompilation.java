package io.intellixity.federa.engine;

import io.intellixity.federa.schema.CompiledSchema;
import io.intellixity.federa.sdl.SchemaDefinitionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled schema of the data sources that loaded, plus the failures of the others by data source name.
 */
public record SchemaCompilation(CompiledSchema schema, Map<String, SchemaDefinitionException> failures) {
  public SchemaCompilation {
    Objects.requireNonNull(schema, "schema");
    failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures == null ? Map.of() : failures));
  }

  public boolean complete() { return failures.isEmpty(); }
}
