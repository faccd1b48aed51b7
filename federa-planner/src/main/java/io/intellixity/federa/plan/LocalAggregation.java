package io.intellixity.federa.plan;

import io.intellixity.federa.query.SortField;
import io.intellixity.federa.spi.sql.AggregateItem;

import java.util.List;
import java.util.Objects;

/**
 * Aggregation computed in process over fetched rows. Without keys the result is one row; with keys one
 * row per distinct key tuple, then sorted and paged by output label.
 */
public record LocalAggregation(List<GroupKey> keys, List<AggregateItem> items, List<SortField> orderBy,
                               Integer limit, Integer offset) {
  public LocalAggregation {
    keys = List.copyOf(keys == null ? List.of() : keys);
    items = List.copyOf(items == null ? List.of() : items);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
  }

  public static LocalAggregation of(List<AggregateItem> items) {
    return new LocalAggregation(List.of(), items, List.of(), null, null);
  }

  public boolean grouped() { return !keys.isEmpty(); }

  /** Group row value {@code output} copied from input label {@code input}. */
  public record GroupKey(String output, String input) {
    public GroupKey {
      Objects.requireNonNull(output, "output");
      Objects.requireNonNull(input, "input");
    }
  }
}
