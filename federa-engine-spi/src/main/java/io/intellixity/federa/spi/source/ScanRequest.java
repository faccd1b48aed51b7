package io.intellixity.federa.spi.source;

import io.intellixity.federa.query.QueryElement;
import io.intellixity.federa.query.SortField;

import java.util.*;

/**
 * Structured request for sources that do not speak SQL (HTTP APIs, files, in-memory collections).
 * <p>
 * {@code object} is the physical source name of the data object. Filters only contain conditions on
 * the object's own fields; relation filters are resolved by the planner before the request is built.
 */
public record ScanRequest(String dataSource, Action action, String object, List<String> fields,
                          QueryElement filter, List<SortField> orderBy, Integer limit, Integer offset,
                          List<String> distinctOn, Map<String, Object> args, Map<String, Object> values)
    implements NativeQuery {

  public enum Action { SELECT, INSERT, UPDATE, DELETE }

  public ScanRequest {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(object, "object");
    fields = List.copyOf(fields == null ? List.of() : fields);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    distinctOn = List.copyOf(distinctOn == null ? List.of() : distinctOn);
    args = Collections.unmodifiableMap(new LinkedHashMap<>(args == null ? Map.of() : args));
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
  }

  public static ScanRequest select(String dataSource, String object, List<String> fields, QueryElement filter,
                                   List<SortField> orderBy, Integer limit, Integer offset) {
    return new ScanRequest(dataSource, Action.SELECT, object, fields, filter, orderBy, limit, offset, null, null, null);
  }
}
