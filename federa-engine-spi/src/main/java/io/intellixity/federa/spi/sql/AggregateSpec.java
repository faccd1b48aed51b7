package io.intellixity.federa.spi.sql;

import io.intellixity.federa.query.QueryElement;
import io.intellixity.federa.query.SortField;

import java.util.*;

/**
 * Aggregation over the rows of one data object.
 * <p>
 * Without {@code keys} the result is a single row and {@code orderBy}, {@code limit}, {@code offset}
 * and {@code distinctOn} select the rows that are aggregated. With keys (bucket aggregation) there is
 * one row per distinct key and those clauses apply to the groups; {@code orderBy} then references
 * key and aggregate outputs.
 */
public record AggregateSpec(int objectId, Map<String, Object> args, QueryElement filter, List<Projection> keys,
                            List<AggregateItem> items, List<SortField> orderBy, Integer limit, Integer offset,
                            List<String> distinctOn, boolean withDeleted) {
  public AggregateSpec {
    args = Collections.unmodifiableMap(new LinkedHashMap<>(args == null ? Map.of() : args));
    keys = List.copyOf(keys == null ? List.of() : keys);
    items = List.copyOf(items == null ? List.of() : items);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    distinctOn = List.copyOf(distinctOn == null ? List.of() : distinctOn);
    for (Projection k : keys) {
      if (k instanceof Projection.NestedAggregation || k instanceof Projection.FunctionRows) {
        throw new IllegalArgumentException("unsupported bucket key " + k.output());
      }
    }
  }

  public boolean bucketed() { return !keys.isEmpty(); }

  public static Builder builder(int objectId) {
    return new Builder(objectId);
  }

  public Builder toBuilder() {
    Builder b = new Builder(objectId);
    b.args.putAll(args);
    b.filter = filter;
    b.keys.addAll(keys);
    b.items.addAll(items);
    b.orderBy.addAll(orderBy);
    b.limit = limit;
    b.offset = offset;
    b.distinctOn.addAll(distinctOn);
    b.withDeleted = withDeleted;
    return b;
  }

  public static final class Builder {
    private final int objectId;
    private final Map<String, Object> args = new LinkedHashMap<>();
    private QueryElement filter;
    private final List<Projection> keys = new ArrayList<>();
    private final List<AggregateItem> items = new ArrayList<>();
    private final List<SortField> orderBy = new ArrayList<>();
    private Integer limit;
    private Integer offset;
    private final List<String> distinctOn = new ArrayList<>();
    private boolean withDeleted;

    private Builder(int objectId) {
      this.objectId = objectId;
    }

    public Builder args(Map<String, Object> v) { if (v != null) this.args.putAll(v); return this; }
    public Builder filter(QueryElement v) { this.filter = v; return this; }
    public Builder key(Projection v) { this.keys.add(v); return this; }
    public Builder item(AggregateItem v) { this.items.add(v); return this; }
    public Builder orderBy(List<SortField> v) { if (v != null) this.orderBy.addAll(v); return this; }
    public Builder limit(Integer v) { this.limit = v; return this; }
    public Builder offset(Integer v) { this.offset = v; return this; }
    public Builder distinctOn(List<String> v) { if (v != null) this.distinctOn.addAll(v); return this; }
    public Builder withDeleted(boolean v) { this.withDeleted = v; return this; }

    public AggregateSpec build() {
      return new AggregateSpec(objectId, args, filter, keys, items, orderBy, limit, offset, distinctOn, withDeleted);
    }
  }
}
