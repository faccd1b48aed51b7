package io.intellixity.federa.query;

import java.util.Locale;

/**
 * Scalar filter operators. The GraphQL name is the input field name used in generated
 * {@code *Filter} input types.
 */
public enum Operator {
  EQ("eq"),
  IN("in"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),
  IS_NULL("is_null"),
  LIKE("like"),
  ILIKE("ilike"),
  REGEX("regex"),

  // list and geometry fields
  CONTAINS("contains"),
  INTERSECTS("intersects");

  private final String graphqlName;

  Operator(String graphqlName) {
    this.graphqlName = graphqlName;
  }

  public String graphqlName() { return graphqlName; }

  public static Operator fromGraphqlName(String name) {
    for (Operator op : values()) {
      if (op.graphqlName.equals(name)) return op;
    }
    throw new QueryValidationException("Unknown filter operator '" + name + "'");
  }

  @Override
  public String toString() { return graphqlName.toUpperCase(Locale.ROOT); }
}
