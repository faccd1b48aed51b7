package io.intellixity.federa.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scalar function call per fetched row, on the function's own source. Calls with equal arguments are
 * made once per request.
 *
 * @param fieldArgs function argument to row label
 */
public record FunctionCallStep(String label, String dataSource, String module, String function,
                               Map<String, String> fieldArgs, Map<String, Object> constArgs) {
  public FunctionCallStep {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(dataSource, "dataSource");
    Objects.requireNonNull(function, "function");
    module = module == null ? "" : module;
    fieldArgs = Collections.unmodifiableMap(new LinkedHashMap<>(fieldArgs == null ? Map.of() : fieldArgs));
    constArgs = Collections.unmodifiableMap(new LinkedHashMap<>(constArgs == null ? Map.of() : constArgs));
  }
}
