package io.intellixity.paginator.jdbc;

import io.intellixity.paginator.exec.PageSpec;
import io.intellixity.paginator.exec.QueryExecutor;
import io.intellixity.paginator.jdbc.dialect.JdbcDialect;
import io.intellixity.paginator.query.QueryElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs page and count statements over a {@link DataSource}; one connection per statement.
 */
public final class JdbcQueryExecutor<T> implements QueryExecutor<SqlQuery, T> {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final DataSource ds;
  private final JdbcDialect dialect;
  private final JdbcRowMapper<T> mapper;

  public JdbcQueryExecutor(DataSource ds, JdbcDialect dialect, JdbcRowMapper<T> mapper) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Rows as column label to value maps. */
  public static JdbcQueryExecutor<Map<String, Object>> forMaps(DataSource ds, JdbcDialect dialect) {
    return new JdbcQueryExecutor<>(ds, dialect, JdbcRowMapper.columnMap());
  }

  public JdbcDialect dialect() {
    return dialect;
  }

  @Override
  public List<T> select(SqlQuery base, PageSpec spec) {
    SqlStatement ss = dialect.mergeSelect(base, spec);
    String jdbcSql = NamedParams.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("SELECT", ss, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(rs));
        debugDone("SELECT", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new JdbcExecutionException("SELECT", e);
    }
  }

  @Override
  public long count(SqlQuery base, QueryElement boundary) {
    SqlStatement ss = dialect.mergeCount(base, boundary);
    String jdbcSql = NamedParams.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("COUNT", ss, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        long v = rs.next() ? rs.getLong(1) : 0;
        debugDone("COUNT", v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw new JdbcExecutionException("COUNT", e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      ps.setObject(i + 1, encode(ss.binds().get(i).value()));
    }
  }

  static Object encode(Object v) {
    if (v instanceof Instant i) return Timestamp.from(i);
    if (v instanceof java.util.Date d && !(v instanceof java.sql.Date) && !(v instanceof Timestamp)) {
      return new Timestamp(d.getTime());
    }
    return v;
  }

  private static void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("paginator.jdbc op={} bindCount={} sql={}", op, ss.binds().size(), jdbcSql);

    // bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        log.trace("paginator.jdbc bind index={} typeId={} valueType={}",
            idx++, b.typeId(), v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private static void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("paginator.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
