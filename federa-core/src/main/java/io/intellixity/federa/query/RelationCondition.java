package io.intellixity.federa.query;

import java.util.Objects;

/**
 * Filter over a related object. To-one relations use {@link Quantifier#DIRECT}, to-many relations
 * use one of the list quantifiers.
 */
public final class RelationCondition implements QueryElement {
  public enum Quantifier {
    DIRECT("direct"),
    ANY_OF("any_of"),
    ALL_OF("all_of"),
    NONE_OF("none_of");

    private final String graphqlName;

    Quantifier(String graphqlName) { this.graphqlName = graphqlName; }

    public String graphqlName() { return graphqlName; }
  }

  private final String relation;
  private final Quantifier quantifier;
  private final QueryElement element;

  public RelationCondition(String relation, Quantifier quantifier, QueryElement element) {
    this.relation = Objects.requireNonNull(relation, "relation");
    this.quantifier = Objects.requireNonNull(quantifier, "quantifier");
    this.element = Objects.requireNonNull(element, "element");
  }

  public String relation() { return relation; }
  public Quantifier quantifier() { return quantifier; }
  public QueryElement element() { return element; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return relation + "." + quantifier.graphqlName() + "(" + element + ")"; }
}
