package io.intellixity.paginator.jdbc;

import io.intellixity.paginator.exec.PageSpec;
import io.intellixity.paginator.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.paginator.query.OrderTerm;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.paginator.query.QueryFilters.gt;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryExecutorTest {
  private static final AbstractJdbcSqlDialect ANSI = new AbstractJdbcSqlDialect() {
    @Override public String id() { return "ansi"; }

    @Override
    protected String quoteIdent(String ident) {
      return "\"" + ident + "\"";
    }
  };

  private static final SqlQuery PEOPLE = SqlQuery.of("SELECT id, name FROM people WHERE tenant = :t", Map.of("t", "acme"));

  private static Map<String, Object> row(Object id, Object name) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", id);
    m.put("name", name);
    return m;
  }

  @Test
  void selectRewritesParamsAndMapsRows() {
    FakeJdbc db = new FakeJdbc();
    db.rows = List.of(row(1, "ann"), row(2, null));
    JdbcQueryExecutor<Map<String, Object>> ex = JdbcQueryExecutor.forMaps(db.dataSource(), ANSI);

    Instant after = Instant.parse("2024-01-01T00:00:00Z");
    List<Map<String, Object>> out = ex.select(PEOPLE,
        new PageSpec(List.of(OrderTerm.value("created", OrderTerm.Direction.ASC)), gt("created", after), 2));

    assertEquals(List.of(row(1, "ann"), row(2, null)), out);
    assertEquals(List.of("SELECT id, name FROM people WHERE (tenant = ?) AND (\"created\" > ?)"
        + " ORDER BY \"created\" ASC FETCH FIRST 2 ROWS ONLY"), db.preparedSql);
    assertEquals(Map.of(1, "acme", 2, Timestamp.from(after)), db.boundParams.get(0));
    assertEquals(0, db.openConnections);
  }

  @Test
  void countReadsFirstColumn() {
    FakeJdbc db = new FakeJdbc();
    db.rows = List.of(Map.of("count", 5L));
    JdbcQueryExecutor<Map<String, Object>> ex = JdbcQueryExecutor.forMaps(db.dataSource(), ANSI);

    assertEquals(5L, ex.count(PEOPLE, null));
    assertEquals("SELECT COUNT(1) FROM (SELECT id, name FROM people WHERE tenant = ?) paginator_count",
        db.preparedSql.get(0));
    assertEquals(0, db.openConnections);
  }

  @Test
  void emptyCountResultIsZero() {
    FakeJdbc db = new FakeJdbc();
    assertEquals(0L, JdbcQueryExecutor.forMaps(db.dataSource(), ANSI).count(PEOPLE, gt("id", 3)));
  }

  @Test
  void driverFailureIsWrapped() {
    FakeJdbc db = new FakeJdbc();
    db.failOnPrepare = new SQLException("relation \"people\" does not exist", "42P01", 7);
    JdbcQueryExecutor<Map<String, Object>> ex = JdbcQueryExecutor.forMaps(db.dataSource(), ANSI);

    JdbcExecutionException e = assertThrows(JdbcExecutionException.class,
        () -> ex.select(PEOPLE, new PageSpec(List.of(), null, 10)));
    assertEquals("SELECT", e.info().get("op"));
    assertEquals("42P01", e.info().get("sqlState"));
    assertEquals(7, e.info().get("errorCode"));
    assertSame(db.failOnPrepare, e.getCause());
    assertEquals(0, db.openConnections);
  }

  @Test
  void encodesTemporalBinds() {
    Date d = new Date(86_400_000L);
    assertEquals(new Timestamp(86_400_000L), JdbcQueryExecutor.encode(d));
    Timestamp ts = new Timestamp(5L);
    assertSame(ts, JdbcQueryExecutor.encode(ts));
    LocalDate day = LocalDate.of(2024, 2, 29);
    assertSame(day, JdbcQueryExecutor.encode(day));
    assertNull(JdbcQueryExecutor.encode(null));
  }
}
