package io.intellixity.federa.spi.sql;

import java.util.*;

/**
 * Function used in place of a table. {@code parentFieldArgs} maps function arguments to fields of the
 * enclosing row and is only valid for nested reads.
 */
public record FunctionSource(String module, String name, Map<String, Object> args, Map<String, String> parentFieldArgs) {
  public FunctionSource {
    Objects.requireNonNull(name, "name");
    module = module == null ? "" : module;
    args = Collections.unmodifiableMap(new LinkedHashMap<>(args == null ? Map.of() : args));
    parentFieldArgs = Collections.unmodifiableMap(
        new LinkedHashMap<>(parentFieldArgs == null ? Map.of() : parentFieldArgs));
  }
}
