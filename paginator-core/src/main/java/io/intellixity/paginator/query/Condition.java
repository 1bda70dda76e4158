package io.intellixity.paginator.query;

import java.util.Objects;

public record Condition(String property, Operator operator, Object value) implements QueryElement {
  public Condition {
    Objects.requireNonNull(property, "property");
    Objects.requireNonNull(operator, "operator");
    if (value == null && operator.isOrdering()) {
      throw new IllegalArgumentException(operator + " requires non-null value");
    }
  }

  public boolean isNullCheck() {
    return value == null;
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    if (value == null) return property + (operator == Operator.EQ ? " IS NULL" : " IS NOT NULL");
    return property + " " + operator.symbol() + " " + (value instanceof String s ? "'" + s + "'" : value);
  }
}
