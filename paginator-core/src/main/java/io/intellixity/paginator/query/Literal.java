package io.intellixity.paginator.query;

/** Constant predicate. {@link #FALSE} matches no row, {@link #TRUE} matches every row. */
public enum Literal implements QueryElement {
  TRUE,
  FALSE;

  public static Literal of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean value() {
    return this == TRUE;
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return visitor.visit(this);
  }
}
