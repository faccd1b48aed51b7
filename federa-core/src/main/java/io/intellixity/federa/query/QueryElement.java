package io.intellixity.federa.query;

/** Node of a filter tree. Property names are field names of the filtered data object. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
