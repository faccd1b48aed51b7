package io.intellixity.federa.plan;

import io.intellixity.federa.query.RelationCondition;

import java.util.List;
import java.util.Objects;

/**
 * Parent filter over a relation that cannot be pushed down. The key read runs first; its key tuples
 * replace {@code condition} in the parent filter as {@code parentFields IN keys}, negated when
 * {@code negate} is set.
 *
 * @param condition the relation condition to replace (by identity), or {@code null} for an inner local
 *                  join: the key condition is ANDed into the parent filter, and a failed key read leaves
 *                  the parent unrestricted
 */
public record SemiJoin(RelationCondition condition, ReadNode keys, List<String> parentFields, List<String> keyLabels,
                       boolean negate) {
  public SemiJoin {
    Objects.requireNonNull(keys, "keys");
    parentFields = List.copyOf(parentFields);
    keyLabels = List.copyOf(keyLabels);
    if (parentFields.isEmpty() || parentFields.size() != keyLabels.size()) {
      throw new IllegalArgumentException("semi-join keys " + parentFields + " / " + keyLabels + " do not line up");
    }
  }
}
