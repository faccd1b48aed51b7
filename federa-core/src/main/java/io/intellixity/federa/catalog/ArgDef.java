package io.intellixity.federa.catalog;

import java.util.Objects;

/** Argument of a parameterized view or a function. */
public record ArgDef(String name, FieldType type, Object defaultValue) {
  public ArgDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public boolean required() { return type.nonNull() && defaultValue == null; }
}
