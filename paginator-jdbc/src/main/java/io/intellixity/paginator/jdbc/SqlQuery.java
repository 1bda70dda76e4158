package io.intellixity.paginator.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Application base query: a plain {@code SELECT ... FROM ... [WHERE ...]} with {@code :name}
 * parameters and no {@code ORDER BY} or {@code LIMIT}; those are added per page.
 */
public record SqlQuery(String sql, Map<String, Object> params) {
  public SqlQuery {
    Objects.requireNonNull(sql, "sql");
    // values may be null
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public static SqlQuery of(String sql) {
    return new SqlQuery(sql, Map.of());
  }

  public static SqlQuery of(String sql, Map<String, Object> params) {
    return new SqlQuery(sql, params);
  }
}
