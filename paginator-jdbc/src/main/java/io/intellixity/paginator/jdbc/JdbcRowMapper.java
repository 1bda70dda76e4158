package io.intellixity.paginator.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps the current result set row. Must not move the cursor. */
@FunctionalInterface
public interface JdbcRowMapper<T> {
  T map(ResultSet rs) throws SQLException;

  /** Column label to value, in select-list order. */
  static JdbcRowMapper<Map<String, Object>> columnMap() {
    return rs -> {
      ResultSetMetaData md = rs.getMetaData();
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= md.getColumnCount(); i++) {
        row.put(md.getColumnLabel(i), rs.getObject(i));
      }
      return row;
    };
  }
}
