package io.intellixity.federa.catalog;

import java.util.Objects;

public record DataSourceInfo(String name, String type, String prefix, boolean readOnly, boolean asModule,
                             Capabilities capabilities) {
  public DataSourceInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(capabilities, "capabilities");
    prefix = (prefix == null || prefix.isBlank()) ? null : prefix;
  }

  public String prefixed(String name) {
    return prefix == null ? name : prefix + "_" + name;
  }
}
