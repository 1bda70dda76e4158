package io.intellixity.paginator.query;

import java.util.Objects;

/** Unary NOT for a query subtree (can wrap a {@link Condition} or a {@link LogicalGroup}). */
public record NotElement(QueryElement element) implements QueryElement {
  public NotElement {
    Objects.requireNonNull(element, "element");
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return visitor.visit(this);
  }

  @Override
  public String toString() {
    return "NOT (" + element + ")";
  }
}
