package io.intellixity.federa.spi.sql;

import java.util.Objects;

/**
 * One aggregate. {@code field} is null for {@code _rows_count}. {@code separator} only applies to
 * {@code string_agg}.
 */
public record AggregateItem(String output, String field, String function, boolean distinct, String separator) {
  public static final String ROWS_COUNT = "_rows_count";

  public AggregateItem {
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(function, "function");
    if (field == null && !ROWS_COUNT.equals(function)) {
      throw new IllegalArgumentException("aggregate " + function + " needs a field");
    }
  }

  public static AggregateItem rowsCount(String output) {
    return new AggregateItem(output, null, ROWS_COUNT, false, null);
  }

  public static AggregateItem of(String output, String field, String function) {
    return new AggregateItem(output, field, function, false, null);
  }

  public boolean rowsCount() { return field == null; }
}
