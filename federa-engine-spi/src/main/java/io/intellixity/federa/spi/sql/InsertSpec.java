package io.intellixity.federa.spi.sql;

import java.util.*;

/** Insert of one row; {@code returning} lists the fields read back from the inserted row. */
public record InsertSpec(int objectId, Map<String, Object> values, List<String> returning) {
  public InsertSpec {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
    returning = List.copyOf(returning == null ? List.of() : returning);
  }
}
