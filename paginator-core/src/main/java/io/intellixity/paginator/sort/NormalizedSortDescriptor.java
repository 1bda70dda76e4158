package io.intellixity.paginator.sort;

import io.intellixity.paginator.error.PaginatorException;
import io.intellixity.paginator.mapping.RowAccessor;
import io.intellixity.paginator.mapping.TemporalValues;
import io.intellixity.paginator.query.Operator;
import io.intellixity.paginator.query.OrderTerm;

import java.util.Collections;
import java.util.Date;
import java.util.Objects;

/**
 * A sort column with every default applied. Immutable; built by {@link SortDescriptors#normalize}.
 */
public final class NormalizedSortDescriptor {
  private final ColumnIdentifier column;
  private final ColumnType type;
  private final boolean nullable;
  private final SortDirection direction;
  private final String valuePath;
  private final CursorValueValidator validator;

  NormalizedSortDescriptor(ColumnIdentifier column, ColumnType type, boolean nullable,
                           SortDirection direction, String valuePath, CursorValueValidator validator) {
    this.column = Objects.requireNonNull(column, "column");
    this.type = Objects.requireNonNull(type, "type");
    this.nullable = nullable;
    this.direction = Objects.requireNonNull(direction, "direction");
    this.valuePath = Objects.requireNonNull(valuePath, "valuePath");
    this.validator = validator;
  }

  public String column() { return column.toString(); }
  public ColumnIdentifier columnIdentifier() { return column; }
  public ColumnType type() { return type; }
  public boolean isNullable() { return nullable; }
  public SortDirection direction() { return direction; }
  public String valuePath() { return valuePath; }

  public OrderTerm.Direction order() { return direction.order(); }
  public OrderTerm.Direction nullOrder() { return direction.nullOrder(); }
  public boolean nullsFirst() { return direction.nullsFirst(); }

  /** Comparison that selects rows strictly past a boundary value. */
  public Operator operator() {
    return direction == SortDirection.ASCENDING ? Operator.GT : Operator.LT;
  }

  public boolean checkType(Object value) {
    return type.check(value);
  }

  /**
   * Validates a boundary value for this column.
   *
   * @throws PaginatorException of the kind chosen by {@code context}
   */
  public void validate(Object value, ValidationContext context) {
    if (value == null) {
      if (!nullable) {
        throw context.failure("Cursor value is null, but column is not nullable",
            Collections.singletonMap("value", null));
      }
      return;
    }
    if (!checkType(value)) {
      throw context.failure("Cursor value does not match its column type",
          PaginatorException.details("value", value, "columnType", type.id()));
    }
    if (validator != null) {
      ValidationOutcome outcome = validator.validate(value);
      if (outcome == null || !outcome.valid()) {
        String msg = outcome == null ? ValidationOutcome.DEFAULT_MESSAGE : outcome.message();
        throw context.failure(msg, PaginatorException.details("value", value));
      }
    }
  }

  /** Reads this column's value from a map-shaped row; see {@link RowAccessor#paths()}. */
  public Object extract(Object row) {
    return extract(row, RowAccessor.paths());
  }

  /**
   * Reads this column's value from a result row and checks it against the declaration.
   * {@link Date} values (JDBC timestamps included) come back as {@code java.time} values so that
   * the cursor keeps their full precision.
   */
  public <T> Object extract(T row, RowAccessor<? super T> rows) {
    Object value = rows.get(row, valuePath);
    if (value instanceof Date d) value = TemporalValues.fromDate(d);
    validate(value, ValidationContext.CONFIGURATION);
    return value;
  }

  /** Value bound into the boundary predicate for an already validated cursor value. */
  public Object boundaryValue(Object value) {
    if (type != ColumnType.DATE || value == null) return value;
    if (value instanceof Date d) return TemporalValues.fromDate(d);
    if (value instanceof String s) return TemporalValues.parse(s);
    return value;
  }

  @Override
  public String toString() {
    return "NormalizedSortDescriptor{" + column + " " + type.id() + (nullable ? " nullable " : " ")
        + direction.id() + (valuePath.equals(column.toString()) ? "" : " path=" + valuePath) + "}";
  }
}
