package io.intellixity.federa.spi.sql;

import io.intellixity.federa.query.QueryElement;
import io.intellixity.federa.query.SortField;

import java.util.*;

/**
 * Relational read of one data object.
 * <p>
 * Nested projections are rendered as correlated sub-selects of the same statement. When {@code cube}
 * is set, rows are grouped by every non-measurement field the read touches before any nested
 * projection is evaluated.
 */
public record SelectSpec(int objectId, FunctionSource function, Map<String, Object> args, List<Projection> projections,
                         QueryElement filter, List<SortField> orderBy, Integer limit, Integer offset,
                         List<String> distinctOn, boolean withDeleted, boolean cube) {
  public SelectSpec {
    args = Collections.unmodifiableMap(new LinkedHashMap<>(args == null ? Map.of() : args));
    projections = List.copyOf(projections == null ? List.of() : projections);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    distinctOn = List.copyOf(distinctOn == null ? List.of() : distinctOn);
    if (projections.isEmpty()) throw new IllegalArgumentException("select of object " + objectId + " has no projections");
  }

  public static Builder builder(int objectId) {
    return new Builder(objectId);
  }

  public Builder toBuilder() {
    Builder b = new Builder(objectId);
    b.function = function;
    b.args.putAll(args);
    b.projections.addAll(projections);
    b.filter = filter;
    b.orderBy.addAll(orderBy);
    b.limit = limit;
    b.offset = offset;
    b.distinctOn.addAll(distinctOn);
    b.withDeleted = withDeleted;
    b.cube = cube;
    return b;
  }

  public static final class Builder {
    private final int objectId;
    private FunctionSource function;
    private final Map<String, Object> args = new LinkedHashMap<>();
    private final List<Projection> projections = new ArrayList<>();
    private QueryElement filter;
    private final List<SortField> orderBy = new ArrayList<>();
    private Integer limit;
    private Integer offset;
    private final List<String> distinctOn = new ArrayList<>();
    private boolean withDeleted;
    private boolean cube;

    private Builder(int objectId) {
      this.objectId = objectId;
    }

    public Builder function(FunctionSource v) { this.function = v; return this; }
    public Builder args(Map<String, Object> v) { if (v != null) this.args.putAll(v); return this; }
    public Builder project(Projection p) { this.projections.add(p); return this; }
    public Builder projections(List<? extends Projection> ps) { this.projections.addAll(ps); return this; }
    public Builder columns(String... fields) {
      for (String f : fields) projections.add(Projection.Column.of(f));
      return this;
    }
    public Builder filter(QueryElement v) { this.filter = v; return this; }
    public Builder orderBy(List<SortField> v) { if (v != null) this.orderBy.addAll(v); return this; }
    public Builder limit(Integer v) { this.limit = v; return this; }
    public Builder offset(Integer v) { this.offset = v; return this; }
    public Builder distinctOn(List<String> v) { if (v != null) this.distinctOn.addAll(v); return this; }
    public Builder withDeleted(boolean v) { this.withDeleted = v; return this; }
    public Builder cube(boolean v) { this.cube = v; return this; }

    public SelectSpec build() {
      return new SelectSpec(objectId, function, args, projections, filter, orderBy, limit, offset, distinctOn,
          withDeleted, cube);
    }
  }
}
