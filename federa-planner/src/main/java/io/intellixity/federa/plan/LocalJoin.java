package io.intellixity.federa.plan;

import java.util.List;
import java.util.Objects;

/**
 * Merge of an independently run child read into the parent rows. The matched child rows (or their
 * aggregate) are stored on each parent row under {@code label}; parent order is preserved.
 *
 * @param junction junction read for many-to-many relations, else {@code null}
 * @param list     to-many: a list of rows; to-one: the first match or {@code null}
 * @param inner    parent rows without a match are dropped
 * @param limit    per-parent limit on matched rows
 * @param aggregation aggregate computed over each parent's matched rows, or {@code null}
 */
public record LocalJoin(String label, ReadNode child, ReadNode junction, JoinPredicate predicate, boolean list,
                        boolean inner, Integer limit, Integer offset, LocalAggregation aggregation,
                        List<Object> path) {
  public LocalJoin {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(child, "child");
    Objects.requireNonNull(predicate, "predicate");
    if ((junction != null) != (predicate instanceof JoinPredicate.Junction)) {
      throw new IllegalArgumentException("junction read and junction predicate go together");
    }
    path = List.copyOf(path == null ? List.of() : path);
  }
}
