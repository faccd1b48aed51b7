package io.intellixity.federa.catalog;

import java.util.List;

/** The {@code args} input of a parameterized view. */
public record ArgsSpec(String inputTypeName, boolean required, List<ArgDef> arguments) {
  public ArgsSpec {
    arguments = List.copyOf(arguments);
  }
}
