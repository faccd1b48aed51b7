package io.intellixity.federa.plan;

import io.intellixity.federa.spi.sql.AggregateSpec;
import io.intellixity.federa.spi.sql.SelectSpec;

import java.util.List;

/**
 * Leaf query against one data source: a relational read or an aggregation, plus the local steps run
 * over its rows.
 * <p>
 * Execution order: semi-join key queries, the native query, {@link #localAggregation()}, function
 * call steps, then local joins. Rows carry values under projection labels.
 */
public final class ReadNode extends PlanNode {
  private final int objectId;
  private final SelectSpec select;
  private final AggregateSpec aggregate;
  private final List<SemiJoin> semiJoins;
  private final LocalAggregation localAggregation;
  private final List<FunctionCallStep> functionCalls;
  private final List<LocalJoin> joins;
  private final boolean scan;

  ReadNode(String dataSource, List<Object> path, int objectId, SelectSpec select, AggregateSpec aggregate,
           List<SemiJoin> semiJoins, LocalAggregation localAggregation, List<FunctionCallStep> functionCalls,
           List<LocalJoin> joins, boolean scan) {
    super(dataSource, path);
    if ((select == null) == (aggregate == null)) {
      throw new IllegalArgumentException("read of object " + objectId + " needs exactly one of select, aggregate");
    }
    this.objectId = objectId;
    this.select = select;
    this.aggregate = aggregate;
    this.semiJoins = List.copyOf(semiJoins == null ? List.of() : semiJoins);
    this.localAggregation = localAggregation;
    this.functionCalls = List.copyOf(functionCalls == null ? List.of() : functionCalls);
    this.joins = List.copyOf(joins == null ? List.of() : joins);
    this.scan = scan;
    resolve(!scan && this.semiJoins.isEmpty() && localAggregation == null && this.functionCalls.isEmpty()
        && this.joins.isEmpty());
  }

  public int objectId() { return objectId; }

  /** Relational read, {@code null} for aggregations. */
  public SelectSpec select() { return select; }

  /** Pushed-down aggregation, {@code null} for relational reads. */
  public AggregateSpec aggregate() { return aggregate; }

  public List<SemiJoin> semiJoins() { return semiJoins; }

  public LocalAggregation localAggregation() { return localAggregation; }

  public List<FunctionCallStep> functionCalls() { return functionCalls; }

  public List<LocalJoin> joins() { return joins; }

  /** The source only takes structured scan requests; every projection is a plain column. */
  public boolean scan() { return scan; }

  @Override
  public String toString() {
    return "ReadNode(" + dataSource() + "#" + objectId + (aggregate != null ? ",aggregate" : "") + ")";
  }
}
