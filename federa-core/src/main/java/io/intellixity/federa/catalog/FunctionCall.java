package io.intellixity.federa.catalog;

import java.util.*;

/**
 * Binding of an object field to a function ({@code @function_call}) or to a table function joined on
 * key fields ({@code @table_function_call_join}).
 *
 * @param arguments function argument name to the object field supplying its value
 */
public record FunctionCall(String function, String module, Map<String, String> arguments,
                           List<String> sourceFields, List<String> targetFields) {
  public FunctionCall {
    Objects.requireNonNull(function, "function");
    module = module == null ? "" : module;
    arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
    sourceFields = List.copyOf(sourceFields == null ? List.of() : sourceFields);
    targetFields = List.copyOf(targetFields == null ? List.of() : targetFields);
  }

  public boolean tableJoin() { return !sourceFields.isEmpty(); }

  public FunctionCall withModule(String resolvedModule) {
    return new FunctionCall(function, resolvedModule, arguments, sourceFields, targetFields);
  }
}
