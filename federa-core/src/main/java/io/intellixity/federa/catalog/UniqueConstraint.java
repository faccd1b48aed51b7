package io.intellixity.federa.catalog;

import java.util.List;

public record UniqueConstraint(List<String> fields, String querySuffix, boolean skipQuery) {
  public UniqueConstraint {
    fields = List.copyOf(fields);
    if (fields.isEmpty()) throw new IllegalArgumentException("unique constraint needs fields");
  }

  /** Suffix of the generated {@code <obj>_<suffix>} query. */
  public String suffix() {
    if (querySuffix != null && !querySuffix.isBlank()) return querySuffix;
    return "by_" + String.join("_", fields);
  }
}
