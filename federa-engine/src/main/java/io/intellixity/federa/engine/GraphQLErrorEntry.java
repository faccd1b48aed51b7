package io.intellixity.federa.engine;

import java.util.*;

/**
 * One entry of the response {@code errors} array. {@code extensions.code} carries the error code.
 */
public record GraphQLErrorEntry(String message, List<Object> path, Map<String, Object> extensions) {
  public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
  public static final String PLANNING_FAILED = "PLANNING_FAILED";
  public static final String ACCESS_DENIED = "ACCESS_DENIED";

  public GraphQLErrorEntry {
    Objects.requireNonNull(message, "message");
    path = Collections.unmodifiableList(new ArrayList<>(path == null ? List.of() : path));
    extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions == null ? Map.of() : extensions));
  }

  public static GraphQLErrorEntry of(String message, List<Object> path, String code) {
    return new GraphQLErrorEntry(message, path, Map.of("code", code));
  }

  public String code() {
    Object c = extensions.get("code");
    return c == null ? null : c.toString();
  }
}
