package io.intellixity.federa.plan;

import io.intellixity.federa.catalog.ScalarType;

import java.util.List;

/** Plan of one response field of the operation, in selection order. */
public sealed interface FieldPlan {
  String responseKey();

  List<Object> path();

  /** Rows of a read: a list, or the first row for single-object fields. */
  record Rows(String responseKey, List<Object> path, ReadNode node, List<Shape> fields, boolean list,
              CachePolicy cache) implements FieldPlan {
    public Rows {
      path = List.copyOf(path);
      fields = List.copyOf(fields);
    }
  }

  /** Value of a scalar function query. */
  record Scalar(String responseKey, List<Object> path, FunctionNode node, ScalarType scalar, CachePolicy cache)
      implements FieldPlan {
    public Scalar {
      path = List.copyOf(path);
    }
  }

  /**
   * Insert (fields over the returned row) or update/delete (fields over {@code success},
   * {@code affected_rows} and {@code message}).
   */
  record Mutation(String responseKey, List<Object> path, MutationNode node, List<Shape> fields)
      implements FieldPlan {
    public Mutation {
      path = List.copyOf(path);
      fields = List.copyOf(fields);
    }
  }

  /** Module or function namespace. */
  record Group(String responseKey, List<Object> path, List<FieldPlan> fields) implements FieldPlan {
    public Group {
      path = List.copyOf(path);
      fields = List.copyOf(fields);
    }
  }

  record Typename(String responseKey, List<Object> path, String typeName) implements FieldPlan {
    public Typename {
      path = List.copyOf(path);
    }
  }

  /** Field the caller's role may not see; always {@code null}. */
  record Redacted(String responseKey, List<Object> path) implements FieldPlan {
    public Redacted {
      path = List.copyOf(path);
    }
  }

  /** {@code __schema} or {@code __type}, answered from the compiled schema. */
  record Introspection(String responseKey, List<Object> path) implements FieldPlan {
    public Introspection {
      path = List.copyOf(path);
    }
  }
}
