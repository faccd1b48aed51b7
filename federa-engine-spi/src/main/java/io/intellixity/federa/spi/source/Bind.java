package io.intellixity.federa.spi.source;

import io.intellixity.federa.catalog.FieldType;

/** Bind value with the catalog type it was coerced to; {@code type} is null for untyped literals. */
public record Bind(Object value, FieldType type) {
  public static Bind untyped(Object value) {
    return new Bind(value, null);
  }
}
