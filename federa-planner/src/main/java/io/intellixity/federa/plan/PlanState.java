package io.intellixity.federa.plan;

/**
 * Lifecycle of a plan node. The planner moves nodes up to {@code PUSHED_DOWN} or
 * {@code LOCAL_FALLBACK}; the coordinator sets the rest.
 */
public enum PlanState {
  UNPLANNED,
  SOURCE_RESOLVED,
  PUSHDOWN_EVALUATED,
  PUSHED_DOWN,
  LOCAL_FALLBACK,
  SCHEDULED,
  COMPLETED,
  FAILED;

  public boolean canMoveTo(PlanState next) {
    if (next == FAILED) return this != COMPLETED && this != FAILED;
    return switch (this) {
      case UNPLANNED -> next == SOURCE_RESOLVED;
      case SOURCE_RESOLVED -> next == PUSHDOWN_EVALUATED;
      case PUSHDOWN_EVALUATED -> next == PUSHED_DOWN || next == LOCAL_FALLBACK;
      case PUSHED_DOWN, LOCAL_FALLBACK -> next == SCHEDULED;
      case SCHEDULED -> next == COMPLETED;
      case COMPLETED, FAILED -> false;
    };
  }

  public boolean planned() {
    return this == PUSHED_DOWN || this == LOCAL_FALLBACK;
  }
}
