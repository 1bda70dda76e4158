package io.intellixity.paginator.query;

/** Node of a backend-neutral predicate tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
