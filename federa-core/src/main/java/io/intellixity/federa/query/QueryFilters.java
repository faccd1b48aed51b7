package io.intellixity.federa.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return new Condition(property, Operator.EQ, value); }
  public static Condition gt(String property, Object value) { return new Condition(property, Operator.GT, value); }
  public static Condition gte(String property, Object value) { return new Condition(property, Operator.GTE, value); }
  public static Condition lt(String property, Object value) { return new Condition(property, Operator.LT, value); }
  public static Condition lte(String property, Object value) { return new Condition(property, Operator.LTE, value); }
  public static Condition in(String property, Collection<?> values) { return new Condition(property, Operator.IN, List.copyOf(values)); }
  public static Condition isNull(String property, boolean isNull) { return new Condition(property, Operator.IS_NULL, isNull); }
  public static Condition like(String property, String pattern) { return new Condition(property, Operator.LIKE, pattern); }
  public static Condition ilike(String property, String pattern) { return new Condition(property, Operator.ILIKE, pattern); }
  public static Condition regex(String property, String pattern) { return new Condition(property, Operator.REGEX, pattern); }

  public static RelationCondition related(String relation, QueryElement element) {
    return new RelationCondition(relation, RelationCondition.Quantifier.DIRECT, element);
  }

  public static RelationCondition anyOf(String relation, QueryElement element) {
    return new RelationCondition(relation, RelationCondition.Quantifier.ANY_OF, element);
  }

  public static RelationCondition allOf(String relation, QueryElement element) {
    return new RelationCondition(relation, RelationCondition.Quantifier.ALL_OF, element);
  }

  public static RelationCondition noneOf(String relation, QueryElement element) {
    return new RelationCondition(relation, RelationCondition.Quantifier.NONE_OF, element);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  /** AND of the non-null arguments; {@code null} when both are null. */
  public static QueryElement andNullable(QueryElement a, QueryElement b) {
    if (a == null) return b;
    if (b == null) return a;
    return and(a, b);
  }
}
