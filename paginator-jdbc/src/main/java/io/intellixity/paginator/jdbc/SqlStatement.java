package io.intellixity.paginator.jdbc;

import java.util.List;

/** Rendered SQL with {@code :name} placeholders and the binds for them, in placeholder order. */
public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
  }
}
