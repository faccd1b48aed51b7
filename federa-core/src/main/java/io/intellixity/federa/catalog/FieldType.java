package io.intellixity.federa.catalog;

import java.util.Objects;

public record FieldType(ScalarType scalar, boolean list, boolean nonNull) {
  public FieldType {
    Objects.requireNonNull(scalar, "scalar");
  }

  public static FieldType of(ScalarType scalar) {
    return new FieldType(scalar, false, false);
  }

  public static FieldType required(ScalarType scalar) {
    return new FieldType(scalar, false, true);
  }

  public static FieldType listOf(ScalarType scalar) {
    return new FieldType(scalar, true, false);
  }

  @Override
  public String toString() {
    String s = list ? "[" + scalar.graphqlName() + "]" : scalar.graphqlName();
    return nonNull ? s + "!" : s;
  }
}
