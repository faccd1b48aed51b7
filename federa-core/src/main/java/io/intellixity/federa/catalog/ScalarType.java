package io.intellixity.federa.catalog;

import java.util.Optional;

/** Built-in scalar types of the directive SDL, grouped into families that drive filters and aggregations. */
public enum ScalarType {
  STRING("String", Family.STRING),
  INT("Int", Family.NUMERIC),
  BIGINT("BigInt", Family.NUMERIC),
  FLOAT("Float", Family.NUMERIC),
  BOOLEAN("Boolean", Family.BOOLEAN),
  DATE("Date", Family.TEMPORAL),
  TIMESTAMP("Timestamp", Family.TEMPORAL),
  TIME("Time", Family.TEMPORAL),
  JSON("JSON", Family.OTHER),
  GEOMETRY("Geometry", Family.GEOMETRY),
  VECTOR("Vector", Family.OTHER);

  public enum Family { STRING, NUMERIC, BOOLEAN, TEMPORAL, GEOMETRY, OTHER }

  private final String graphqlName;
  private final Family family;

  ScalarType(String graphqlName, Family family) {
    this.graphqlName = graphqlName;
    this.family = family;
  }

  public String graphqlName() { return graphqlName; }
  public Family family() { return family; }

  /** Timestamp and Date values can be truncated to buckets and have extractable parts. */
  public boolean isDateLike() { return this == DATE || this == TIMESTAMP; }

  public static Optional<ScalarType> byGraphqlName(String name) {
    if ("ID".equals(name)) return Optional.of(STRING);
    for (ScalarType t : values()) {
      if (t.graphqlName.equals(name)) return Optional.of(t);
    }
    return Optional.empty();
  }
}
