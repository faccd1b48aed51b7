package io.intellixity.federa.spi.source;

import java.util.*;

/** Rows keyed by column label (selects, RETURNING) or the affected row count (DML). */
public record SourceResult(List<Map<String, Object>> rows, long affectedRows) {
  public SourceResult {
    rows = Collections.unmodifiableList(new ArrayList<>(rows == null ? List.of() : rows));
  }

  public static SourceResult ofRows(List<Map<String, Object>> rows) {
    return new SourceResult(rows, rows == null ? 0 : rows.size());
  }

  public static SourceResult ofCount(long affectedRows) {
    return new SourceResult(List.of(), affectedRows);
  }
}
