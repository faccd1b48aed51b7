package io.intellixity.federa.sdl;

import io.intellixity.federa.catalog.SdlLocation;

import java.util.Objects;

public record SchemaError(Code code, String message, SdlLocation location) {
  public enum Code {
    SYNTAX,
    UNKNOWN_DIRECTIVE,
    WRONG_LOCATION,
    MISSING_ARGUMENT,
    DUPLICATE_OBJECT,
    UNRESOLVED_REFERENCE,
    INVALID_CARDINALITY,
    CROSS_SOURCE_RELATION,
    NAME_COLLISION,
    INVALID_DEFINITION
  }

  public SchemaError {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
    location = location == null ? SdlLocation.UNKNOWN : location;
  }

  @Override
  public String toString() { return code + " at " + location + ": " + message; }
}
