package io.intellixity.paginator.jdbc;

import io.intellixity.paginator.error.PaginatorException;

import java.sql.SQLException;

/** A statement issued by {@link JdbcQueryExecutor} failed in the driver or the database. */
public final class JdbcExecutionException extends PaginatorException {
  public JdbcExecutionException(String op, SQLException cause) {
    super("JDBC " + op + " failed: " + cause.getMessage(),
        PaginatorException.details("op", op, "sqlState", cause.getSQLState(), "errorCode", cause.getErrorCode()),
        cause);
  }
}
