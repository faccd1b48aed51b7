package io.intellixity.federa.catalog;

public enum Cardinality {
  ONE_TO_ONE,
  MANY_TO_ONE,
  ONE_TO_MANY,
  MANY_TO_MANY;

  public boolean isToMany() {
    return this == ONE_TO_MANY || this == MANY_TO_MANY;
  }

  public Cardinality inverse() {
    return switch (this) {
      case ONE_TO_ONE -> ONE_TO_ONE;
      case MANY_TO_ONE -> ONE_TO_MANY;
      case ONE_TO_MANY -> MANY_TO_ONE;
      case MANY_TO_MANY -> MANY_TO_MANY;
    };
  }
}
