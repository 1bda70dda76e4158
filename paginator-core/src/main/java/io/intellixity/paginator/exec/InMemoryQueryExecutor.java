package io.intellixity.paginator.exec;

import io.intellixity.paginator.mapping.RowAccessor;
import io.intellixity.paginator.mapping.TemporalValues;
import io.intellixity.paginator.query.Clause;
import io.intellixity.paginator.query.Condition;
import io.intellixity.paginator.query.Literal;
import io.intellixity.paginator.query.LogicalGroup;
import io.intellixity.paginator.query.NotElement;
import io.intellixity.paginator.query.OrderTerm;
import io.intellixity.paginator.query.QueryElement;
import io.intellixity.paginator.query.QueryVisitor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes pages over an already materialized list of rows.\n
 *
 * - comparisons against {@code null} are UNKNOWN and filter the row out, as in SQL\n
 * - null-check order terms sort {@code false} before {@code true}\n
 * - plain order terms treat {@code null} as larger than any value\n
 * - numbers compare by value regardless of boxed type; zoned dates compare as instants\n
 *
 * Columns are read from rows with a {@link RowAccessor} (map rows by default); {@code columnPaths}
 * remaps a column (e.g. {@code people.id}) to a different value path (e.g. {@code id}).\n
 */
public final class InMemoryQueryExecutor<T> implements QueryExecutor<List<T>, T> {
  private final RowAccessor<? super T> rows;
  private final Map<String, String> columnPaths;

  public InMemoryQueryExecutor() {
    this(RowAccessor.paths(), Map.of());
  }

  public InMemoryQueryExecutor(Map<String, String> columnPaths) {
    this(RowAccessor.paths(), columnPaths);
  }

  public InMemoryQueryExecutor(RowAccessor<? super T> rows) {
    this(rows, Map.of());
  }

  public InMemoryQueryExecutor(RowAccessor<? super T> rows, Map<String, String> columnPaths) {
    this.rows = Objects.requireNonNull(rows, "rows");
    this.columnPaths = Map.copyOf(Objects.requireNonNull(columnPaths, "columnPaths"));
  }

  @Override
  public List<T> select(List<T> base, PageSpec spec) {
    return base.stream()
        .filter(row -> matches(row, spec.boundary()))
        .sorted(comparator(spec.orderTerms()))
        .limit(spec.limit())
        .toList();
  }

  @Override
  public long count(List<T> base, QueryElement boundary) {
    return base.stream().filter(row -> matches(row, boundary)).count();
  }

  private boolean matches(T row, QueryElement boundary) {
    return boundary == null || Boolean.TRUE.equals(boundary.accept(new Evaluator(row)));
  }

  private Object column(T row, String column) {
    return rows.get(row, columnPaths.getOrDefault(column, column));
  }

  private Comparator<T> comparator(List<OrderTerm> terms) {
    Comparator<T> out = (a, b) -> 0;
    for (OrderTerm t : terms) {
      Comparator<T> c = t.nullCheck()
          ? (a, b) -> Boolean.compare(column(a, t.column()) == null, column(b, t.column()) == null)
          : (a, b) -> compareNullsLast(column(a, t.column()), column(b, t.column()));
      out = out.thenComparing(t.direction() == OrderTerm.Direction.DESC ? c.reversed() : c);
    }
    return out;
  }

  private static int compareNullsLast(Object a, Object b) {
    if (a == null) return b == null ? 0 : 1;
    if (b == null) return -1;
    return compare(a, b);
  }

  /** Compares two non-null values. */
  static int compare(Object a, Object b) {
    Object x = normalize(a, b);
    Object y = normalize(b, a);
    if (x instanceof Comparable<?> && y != null && x.getClass() == y.getClass()) {
      @SuppressWarnings("unchecked")
      Comparable<Object> cx = (Comparable<Object>) x;
      return cx.compareTo(y);
    }
    throw new IllegalArgumentException("Cannot compare " + a.getClass().getSimpleName()
        + " with " + b.getClass().getSimpleName());
  }

  private static Object normalize(Object v, Object other) {
    if (v instanceof Number n) return toBigDecimal(n);
    if (v instanceof String s && isTemporal(other)) return TemporalValues.toInstantIfZoned(TemporalValues.parse(s));
    return TemporalValues.toInstantIfZoned(v);
  }

  private static boolean isTemporal(Object v) {
    return v instanceof Temporal || v instanceof Date;
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof BigInteger bi) return new BigDecimal(bi);
    if (n instanceof Double || n instanceof Float) return new BigDecimal(n.toString());
    return BigDecimal.valueOf(n.longValue());
  }

  /** SQL three-valued logic; {@code null} is UNKNOWN. */
  private final class Evaluator implements QueryVisitor<Boolean> {
    private final T row;

    Evaluator(T row) {
      this.row = row;
    }

    @Override
    public Boolean visit(Condition c) {
      Object actual = column(row, c.property());
      if (c.isNullCheck()) {
        return switch (c.operator()) {
          case EQ -> actual == null;
          case NE -> actual != null;
          default -> throw new IllegalStateException("Null operand for " + c.operator());
        };
      }
      if (actual == null) return null;
      int cmp = compare(actual, c.value());
      return switch (c.operator()) {
        case EQ -> cmp == 0;
        case NE -> cmp != 0;
        case GT -> cmp > 0;
        case GE -> cmp >= 0;
        case LT -> cmp < 0;
        case LE -> cmp <= 0;
      };
    }

    @Override
    public Boolean visit(LogicalGroup g) {
      boolean decisive = g.clause() == Clause.OR;
      boolean unknown = false;
      for (QueryElement e : g.elements()) {
        Boolean v = e.accept(this);
        if (v == null) unknown = true;
        else if (v == decisive) return decisive;
      }
      return unknown ? null : !decisive;
    }

    @Override
    public Boolean visit(NotElement n) {
      Boolean v = n.element().accept(this);
      return v == null ? null : !v;
    }

    @Override
    public Boolean visit(Literal l) {
      return l.value();
    }
  }
}
