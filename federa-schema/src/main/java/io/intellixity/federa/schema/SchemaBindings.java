package io.intellixity.federa.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Generated {@code type.field} coordinates to their {@link FieldBinding}. */
public final class SchemaBindings {
  private final Map<String, FieldBinding> bindings;

  SchemaBindings(Map<String, FieldBinding> bindings) {
    this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
  }

  /** Returns {@code null} for fields without a binding, such as {@code __typename}. */
  public FieldBinding field(String typeName, String fieldName) {
    return bindings.get(coordinate(typeName, fieldName));
  }

  public <T extends FieldBinding> T field(String typeName, String fieldName, Class<T> kind) {
    FieldBinding b = field(typeName, fieldName);
    return kind.isInstance(b) ? kind.cast(b) : null;
  }

  public int size() { return bindings.size(); }

  static String coordinate(String typeName, String fieldName) {
    return Objects.requireNonNull(typeName, "typeName") + "." + Objects.requireNonNull(fieldName, "fieldName");
  }
}
