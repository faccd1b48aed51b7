package io.intellixity.federa.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoleDef(String name, String description, boolean disabled, List<PermissionDef> permissions) {
  public RoleDef {
    Objects.requireNonNull(name, "name");
    permissions = List.copyOf(permissions == null ? List.of() : permissions);
  }
}
