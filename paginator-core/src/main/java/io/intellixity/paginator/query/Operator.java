package io.intellixity.paginator.query;

/**
 * Comparison operators for {@link Condition} leaves.
 *
 * <p>{@link #EQ} / {@link #NE} against a {@code null} value are null checks ({@code IS NULL} /
 * {@code IS NOT NULL}); the ordering operators never accept {@code null}.</p>
 */
public enum Operator {
  EQ("="),
  NE("<>"),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<=");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isOrdering() {
    return this != EQ && this != NE;
  }
}
