package io.intellixity.paginator.query;

import java.util.Locale;
import java.util.Objects;

/**
 * One ORDER BY term.
 *
 * <p>A {@code nullCheck} term orders by the boolean expression {@code (column IS NULL)}, with
 * {@code false} sorting before {@code true}. Pairing it with a plain value term places nulls
 * explicitly instead of relying on engine defaults.</p>
 */
public record OrderTerm(String column, Direction direction, boolean nullCheck) {
  public OrderTerm {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static OrderTerm value(String column, Direction direction) {
    return new OrderTerm(column, direction, false);
  }

  public static OrderTerm isNull(String column, Direction direction) {
    return new OrderTerm(column, direction, true);
  }

  /** Raw clause fragment, e.g. {@code (score is null) asc} or {@code score desc}. */
  public String toRaw() {
    String dir = direction.name().toLowerCase(Locale.ROOT);
    return nullCheck ? "(" + column + " is null) " + dir : column + " " + dir;
  }

  public enum Direction { ASC, DESC }
}
