package io.intellixity.federa.spi.sql;

import io.intellixity.federa.query.QueryElement;

import java.util.*;

public record UpdateSpec(int objectId, Map<String, Object> values, QueryElement filter, boolean withDeleted) {
  public UpdateSpec {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
  }
}
