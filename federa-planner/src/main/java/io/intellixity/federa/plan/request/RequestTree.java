package io.intellixity.federa.plan.request;

import java.util.*;

/** Selected operation of a request document. */
public record RequestTree(Operation operation, String operationName, Map<String, Map<String, Object>> directives,
                          List<SelectedField> fields) {
  public enum Operation { QUERY, MUTATION }

  public RequestTree {
    Objects.requireNonNull(operation, "operation");
    directives = Collections.unmodifiableMap(new LinkedHashMap<>(directives == null ? Map.of() : directives));
    fields = List.copyOf(fields == null ? List.of() : fields);
  }

  public boolean hasDirective(String directive) { return directives.containsKey(directive); }

  public Map<String, Object> directive(String directive) { return directives.get(directive); }

  /** Every top-level field is {@code __schema}, {@code __type} or {@code __typename}. */
  public boolean introspectionOnly() {
    for (SelectedField f : fields) {
      if (!f.isIntrospection() && !f.isTypename()) return false;
    }
    return !fields.isEmpty();
  }
}
