package io.intellixity.federa.plan;

import java.util.List;
import java.util.Objects;

/** Unit of work against one data source. */
public abstract class PlanNode {
  private final String dataSource;
  private final List<Object> path;
  private volatile PlanState state = PlanState.UNPLANNED;

  protected PlanNode(String dataSource, List<Object> path) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.path = List.copyOf(path == null ? List.of() : path);
  }

  public String dataSource() { return dataSource; }

  /** Response path of the field this node serves. */
  public List<Object> path() { return path; }

  public PlanState state() { return state; }

  public synchronized void moveTo(PlanState next) {
    if (!state.canMoveTo(next)) {
      throw new IllegalStateException("Plan node " + this + " cannot move from " + state + " to " + next);
    }
    state = next;
  }

  /** Marks the node planned: resolved, evaluated, then pushed down or local fallback. */
  void resolve(boolean pushedDown) {
    moveTo(PlanState.SOURCE_RESOLVED);
    moveTo(PlanState.PUSHDOWN_EVALUATED);
    moveTo(pushedDown ? PlanState.PUSHED_DOWN : PlanState.LOCAL_FALLBACK);
  }
}
