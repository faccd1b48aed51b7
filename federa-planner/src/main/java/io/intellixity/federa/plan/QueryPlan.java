package io.intellixity.federa.plan;

import io.intellixity.federa.plan.request.RequestTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Planned operation: one {@link FieldPlan} per top-level response field. */
public record QueryPlan(RequestTree.Operation operation, List<FieldPlan> fields) {
  public QueryPlan {
    Objects.requireNonNull(operation, "operation");
    fields = List.copyOf(fields);
  }

  /** Top-level reads, in selection order, with module groups flattened. */
  public List<FieldPlan.Rows> reads() {
    List<FieldPlan.Rows> out = new ArrayList<>();
    collect(fields, out);
    return out;
  }

  public boolean hasIntrospection() {
    for (FieldPlan f : fields) {
      if (f instanceof FieldPlan.Introspection) return true;
    }
    return false;
  }

  private static void collect(List<FieldPlan> fields, List<FieldPlan.Rows> out) {
    for (FieldPlan f : fields) {
      if (f instanceof FieldPlan.Rows r) out.add(r);
      else if (f instanceof FieldPlan.Group g) collect(g.fields(), out);
    }
  }
}
