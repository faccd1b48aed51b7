package io.intellixity.federa.plan.request;

import java.util.*;

/**
 * One field of a request with fragments inlined and variables resolved.
 *
 * @param parentType name of the GraphQL type declaring the field
 * @param type       name of the field's unwrapped output type
 * @param arguments  every declared argument with a value, defaults included
 * @param canonical  variable-free rendering of the field and its subtree
 */
public record SelectedField(String responseKey, String name, String parentType, String type,
                            Map<String, Object> arguments, Map<String, Map<String, Object>> directives,
                            List<SelectedField> selections, List<Object> path, String canonical) {
  public static final String TYPENAME = "__typename";

  public SelectedField {
    Objects.requireNonNull(responseKey, "responseKey");
    Objects.requireNonNull(name, "name");
    arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
    directives = Collections.unmodifiableMap(new LinkedHashMap<>(directives == null ? Map.of() : directives));
    selections = List.copyOf(selections == null ? List.of() : selections);
    path = Collections.unmodifiableList(new ArrayList<>(path == null ? List.of() : path));
  }

  public Object argument(String argName) { return arguments.get(argName); }

  @SuppressWarnings("unchecked")
  public Map<String, Object> mapArgument(String argName) {
    Object v = arguments.get(argName);
    return v instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
  }

  public List<?> listArgument(String argName) {
    Object v = arguments.get(argName);
    if (v == null) return List.of();
    return v instanceof List<?> l ? l : List.of(v);
  }

  public Integer intArgument(String argName) {
    Object v = arguments.get(argName);
    return v instanceof Number n ? n.intValue() : null;
  }

  public boolean booleanArgument(String argName) {
    return Boolean.TRUE.equals(arguments.get(argName));
  }

  public boolean hasDirective(String directive) { return directives.containsKey(directive); }

  public Map<String, Object> directive(String directive) { return directives.get(directive); }

  public boolean isTypename() { return TYPENAME.equals(name); }

  public boolean isIntrospection() { return name.startsWith("__") && !isTypename(); }

  public List<Object> childPath(String key) {
    List<Object> p = new ArrayList<>(path);
    p.add(key);
    return p;
  }
}
