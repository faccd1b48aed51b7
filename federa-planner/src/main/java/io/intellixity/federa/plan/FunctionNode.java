package io.intellixity.federa.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Scalar function query: {@code SELECT <function> AS value}. */
public final class FunctionNode extends PlanNode {
  private final String module;
  private final String function;
  private final Map<String, Object> args;

  FunctionNode(String dataSource, List<Object> path, String module, String function, Map<String, Object> args) {
    super(dataSource, path);
    this.module = module == null ? "" : module;
    this.function = Objects.requireNonNull(function, "function");
    this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args == null ? Map.of() : args));
    resolve(true);
  }

  public String module() { return module; }
  public String function() { return function; }
  public Map<String, Object> args() { return args; }

  @Override
  public String toString() { return "FunctionNode(" + dataSource() + "," + module + "." + function + ")"; }
}
