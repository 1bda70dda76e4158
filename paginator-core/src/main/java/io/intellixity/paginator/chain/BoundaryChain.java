package io.intellixity.paginator.chain;

import io.intellixity.paginator.error.ConfigurationException;
import io.intellixity.paginator.error.InvalidCursorException;
import io.intellixity.paginator.mapping.RowAccessor;
import io.intellixity.paginator.query.Condition;
import io.intellixity.paginator.query.Literal;
import io.intellixity.paginator.query.OrderTerm;
import io.intellixity.paginator.query.QueryElement;
import io.intellixity.paginator.query.QueryFilters;
import io.intellixity.paginator.sort.NormalizedSortDescriptor;
import io.intellixity.paginator.sort.ValidationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, non-empty list of sort columns defining a total order, and the logic that turns a row
 * into boundary values and boundary values back into an "after this row" predicate.
 *
 * <p>Represented as a shared array and a start index: {@link #tail()} is O(1) and shares the
 * array with its parent. Instances are immutable and safe to share across threads.</p>
 */
public final class BoundaryChain {
  private final NormalizedSortDescriptor[] descriptors;
  private final int index;
  private final boolean[] nullableFrom;

  private BoundaryChain(NormalizedSortDescriptor[] descriptors, int index, boolean[] nullableFrom) {
    this.descriptors = descriptors;
    this.index = index;
    this.nullableFrom = nullableFrom;
  }

  public static BoundaryChain of(List<NormalizedSortDescriptor> descriptors) {
    if (descriptors == null || descriptors.isEmpty()) {
      throw new ConfigurationException("A sort requires at least one column");
    }
    NormalizedSortDescriptor[] arr = descriptors.toArray(new NormalizedSortDescriptor[0]);
    boolean[] nullableFrom = new boolean[arr.length];
    boolean any = false;
    for (int i = arr.length - 1; i >= 0; i--) {
      any |= arr[i].isNullable();
      nullableFrom[i] = any;
    }
    return new BoundaryChain(arr, 0, nullableFrom);
  }

  public static BoundaryChain of(NormalizedSortDescriptor... descriptors) {
    return of(Arrays.asList(descriptors));
  }

  public int size() {
    return descriptors.length - index;
  }

  public NormalizedSortDescriptor head() {
    return descriptors[index];
  }

  /** Remaining columns after the head, or {@code null} at the last position. */
  public BoundaryChain tail() {
    return index + 1 < descriptors.length ? new BoundaryChain(descriptors, index + 1, nullableFrom) : null;
  }

  public boolean anyNullable() {
    return nullableFrom[index];
  }

  public List<NormalizedSortDescriptor> descriptors() {
    return Collections.unmodifiableList(Arrays.asList(descriptors).subList(index, descriptors.length));
  }

  /**
   * Ordering instructions for this chain. When any column is nullable every position gets a
   * {@code (column IS NULL)} term ahead of its value term.
   */
  public List<OrderTerm> orderTerms() {
    boolean withNullChecks = anyNullable();
    List<OrderTerm> out = new ArrayList<>(withNullChecks ? size() * 2 : size());
    for (int i = index; i < descriptors.length; i++) {
      NormalizedSortDescriptor d = descriptors[i];
      if (withNullChecks) out.add(OrderTerm.isNull(d.column(), d.nullOrder()));
      out.add(OrderTerm.value(d.column(), d.order()));
    }
    return List.copyOf(out);
  }

  /** {@link #orderTerms()} as a raw clause, e.g. {@code (score is null) asc, score asc, id asc}. */
  public String orderByClause() {
    return orderTerms().stream().map(OrderTerm::toRaw).collect(Collectors.joining(", "));
  }

  /**
   * Boundary values of {@code row}, one per position.
   *
   * @throws ConfigurationException if a row value violates its own declaration
   */
  public List<Object> extractBoundary(Object row) {
    return extractBoundary(row, RowAccessor.paths());
  }

  /** Boundary values of a row read through {@code rows}. */
  public <T> List<Object> extractBoundary(T row, RowAccessor<? super T> rows) {
    List<Object> out = new ArrayList<>(size());
    for (int i = index; i < descriptors.length; i++) {
      out.add(descriptors[i].extract(row, rows));
    }
    // may hold nulls
    return Collections.unmodifiableList(out);
  }

  /**
   * Predicate selecting the rows that sort strictly after the row the values were taken from.
   * Values beyond the chain length are ignored.
   *
   * @throws InvalidCursorException if a value fails validation or there are too few values
   */
  public QueryElement applyBoundary(List<?> values) {
    return apply(values, 0, values.size());
  }

  private QueryElement apply(List<?> values, int offset, int total) {
    if (offset >= values.size()) {
      throw new InvalidCursorException("Cursor has too few values",
          Map.of("expected", offset + size(), "actual", total));
    }
    NormalizedSortDescriptor d = head();
    Object raw = values.get(offset);
    d.validate(raw, ValidationContext.CURSOR);

    BoundaryChain tail = tail();
    String n = d.column();
    if (raw == null) {
      if (d.nullsFirst()) {
        Condition notNull = QueryFilters.isNotNull(n);
        return tail == null
            ? notNull
            : QueryFilters.or(notNull, QueryFilters.and(QueryFilters.isNull(n), tail.apply(values, offset + 1, total)));
      }
      return tail == null
          ? Literal.FALSE
          : QueryFilters.and(QueryFilters.isNull(n), tail.apply(values, offset + 1, total));
    }

    Object v = d.boundaryValue(raw);
    QueryElement past = QueryFilters.compare(n, d.operator(), v);
    if (d.isNullable() && !d.nullsFirst()) {
      past = QueryFilters.or(past, QueryFilters.isNull(n));
    }
    if (tail == null) return past;
    return QueryFilters.or(past, QueryFilters.and(QueryFilters.eq(n, v), tail.apply(values, offset + 1, total)));
  }

  @Override
  public String toString() {
    return "BoundaryChain" + descriptors();
  }
}
