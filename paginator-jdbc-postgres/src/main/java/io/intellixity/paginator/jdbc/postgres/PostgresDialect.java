package io.intellixity.paginator.jdbc.postgres;

import io.intellixity.paginator.jdbc.SqlStatement;
import io.intellixity.paginator.jdbc.dialect.AbstractJdbcSqlDialect;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected SqlStatement applyLimit(SqlStatement base, int limit) {
    return new SqlStatement(base.sql() + " LIMIT " + limit, base.binds());
  }
}
