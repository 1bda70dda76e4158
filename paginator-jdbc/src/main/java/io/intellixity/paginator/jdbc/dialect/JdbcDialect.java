package io.intellixity.paginator.jdbc.dialect;

import io.intellixity.paginator.exec.PageSpec;
import io.intellixity.paginator.jdbc.SqlQuery;
import io.intellixity.paginator.jdbc.SqlStatement;
import io.intellixity.paginator.query.QueryElement;

/** Renders page and count statements on top of a base SQL query. */
public interface JdbcDialect {
  String id();

  /** Base query + boundary predicate + ORDER BY + limit. */
  SqlStatement mergeSelect(SqlQuery base, PageSpec spec);

  /** Row count of base query + boundary predicate ({@code null} = no boundary). */
  SqlStatement mergeCount(SqlQuery base, QueryElement boundary);
}
