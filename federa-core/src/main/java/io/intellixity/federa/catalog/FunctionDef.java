package io.intellixity.federa.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Function declared on {@code extend type Function}. {@code sql} references arguments as
 * {@code [$name]}. Exactly one of {@code returnScalar} and {@code returnObject} is set.
 */
public record FunctionDef(String name, String module, String dataSource, String sql, List<ArgDef> arguments,
                          FieldType returnScalar, Integer returnObject, boolean returnsList, boolean skipNullArgs,
                          String description) {
  public FunctionDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(dataSource, "dataSource");
    Objects.requireNonNull(sql, "sql");
    module = module == null ? "" : module;
    arguments = List.copyOf(arguments);
    if ((returnScalar == null) == (returnObject == null)) {
      throw new IllegalArgumentException("function " + name + " must return either a scalar or an object");
    }
  }

  public boolean returnsTable() { return returnObject != null; }

  public ArgDef argument(String argName) {
    for (ArgDef a : arguments) {
      if (a.name().equals(argName)) return a;
    }
    return null;
  }
}
