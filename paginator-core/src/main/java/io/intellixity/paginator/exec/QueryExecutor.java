package io.intellixity.paginator.exec;

import io.intellixity.paginator.query.QueryElement;

import java.util.List;

/**
 * Backend that runs a base query with ordering, a boundary predicate and a limit applied.
 *
 * @param <Q> base query type (SQL text, a query builder, an in-memory list)
 * @param <T> row type
 */
public interface QueryExecutor<Q, T> {
  /** Rows of {@code base} matching the boundary, ordered by the order terms, at most {@code limit}. */
  List<T> select(Q base, PageSpec spec);

  /** Number of rows of {@code base} matching {@code boundary} ({@code null} = all), ignoring any limit. */
  long count(Q base, QueryElement boundary);
}
