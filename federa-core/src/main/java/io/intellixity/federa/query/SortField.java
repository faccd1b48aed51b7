package io.intellixity.federa.query;

import java.util.Objects;

/**
 * One {@code order_by} entry. {@code field} is a dotted path relative to the returned type, e.g.
 * {@code name}, {@code customer.name} or {@code aggregations.total.sum}.
 */
public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }
}
