package io.intellixity.federa.plan;

import io.intellixity.federa.catalog.ScalarType;

import java.util.List;
import java.util.Objects;

/** How one response field is read back from a result row. */
public sealed interface Shape {
  String key();

  /** Row value under {@code label}; {@code scalar} drives output formatting, {@code null} passes it through. */
  record Value(String key, String label, ScalarType scalar) implements Shape {
    public Value {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(label, "label");
    }
  }

  record Typename(String key, String typeName) implements Shape {}

  /** Object assembled from values of the same row, e.g. bucket {@code key} and {@code aggregations}. */
  record Group(String key, List<Shape> fields) implements Shape {
    public Group {
      fields = List.copyOf(fields);
    }
  }

  /** JSON object or array produced by the native query under {@code label}. */
  record Nested(String key, String label, List<Shape> fields, boolean list) implements Shape {
    public Nested {
      fields = List.copyOf(fields);
    }
  }

  /** Rows attached under {@code label} by a {@link LocalJoin} or a local function call. */
  record Joined(String key, String label, List<Shape> fields, boolean list) implements Shape {
    public Joined {
      fields = List.copyOf(fields);
    }
  }

  /** Field the caller's role may not see; always {@code null}. */
  record Redacted(String key) implements Shape {}
}
