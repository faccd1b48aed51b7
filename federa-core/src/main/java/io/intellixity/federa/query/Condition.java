package io.intellixity.federa.query;

import java.util.*;

public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;

  public Condition(String property, Operator operator, Object value) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }

  /** Values of an IN condition, or the single value wrapped. */
  public List<Object> values() {
    if (value == null) return List.of();
    if (value instanceof List<?> l) return new ArrayList<>(l);
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(value);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return property + " " + operator + " " + value; }
}
