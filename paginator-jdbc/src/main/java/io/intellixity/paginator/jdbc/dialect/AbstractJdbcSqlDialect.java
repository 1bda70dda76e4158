package io.intellixity.paginator.jdbc.dialect;

import io.intellixity.paginator.exec.PageSpec;
import io.intellixity.paginator.jdbc.Bind;
import io.intellixity.paginator.jdbc.NamedParams;
import io.intellixity.paginator.jdbc.SqlQuery;
import io.intellixity.paginator.jdbc.SqlStatement;
import io.intellixity.paginator.query.Clause;
import io.intellixity.paginator.query.Condition;
import io.intellixity.paginator.query.Literal;
import io.intellixity.paginator.query.LogicalGroup;
import io.intellixity.paginator.query.NotElement;
import io.intellixity.paginator.query.Operator;
import io.intellixity.paginator.query.OrderTerm;
import io.intellixity.paginator.query.QueryElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - select merging: base SQL + boundary predicate + ORDER BY + limit\n
 * - count merging: base SQL + boundary predicate wrapped in COUNT(1)\n
 *
 * DB-specific dialects override hooks for identifier quoting and limits.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();

    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
  }

  @Override
  public final SqlStatement mergeSelect(SqlQuery base, PageSpec spec) {
    SqlStatement withFilter = appendFilter(baseStatement(base), spec.boundary());
    SqlStatement withSort = appendSort(withFilter, spec.orderTerms());
    return applyLimit(withSort, spec.limit());
  }

  @Override
  public final SqlStatement mergeCount(SqlQuery base, QueryElement boundary) {
    SqlStatement withFilter = appendFilter(baseStatement(base), boundary);
    String sql = "SELECT COUNT(1) FROM (" + withFilter.sql() + ") paginator_count";
    return new SqlStatement(sql, withFilter.binds());
  }

  protected SqlStatement baseStatement(SqlQuery base) {
    String sql = base.sql().trim();
    if (sql.isEmpty()) throw new IllegalArgumentException("Base SQL must not be blank");
    return new SqlStatement(sql, NamedParams.bindsFor(sql, base.params()));
  }

  /**
   * Adds the predicate to the base WHERE clause. An existing top-level condition is parenthesized
   * so that its OR terms keep their meaning.
   */
  protected SqlStatement appendFilter(SqlStatement base, QueryElement filter) {
    if (filter == null) return base;
    RenderCtx ctx = new RenderCtx();
    String predicate = renderPredicateSql(filter, ctx, false);

    String sql;
    int where = topLevelWhere(base.sql());
    if (where < 0) {
      sql = base.sql() + " WHERE " + predicate;
    } else {
      String head = base.sql().substring(0, where);
      String existing = base.sql().substring(where + "WHERE".length()).trim();
      sql = head + "WHERE (" + existing + ") AND (" + predicate + ")";
    }
    List<Bind> binds = new ArrayList<>(base.binds());
    binds.addAll(ctx.binds);
    return new SqlStatement(sql, binds);
  }

  protected SqlStatement appendSort(SqlStatement base, List<OrderTerm> terms) {
    if (terms == null || terms.isEmpty()) return base;
    List<String> parts = new ArrayList<>();
    for (OrderTerm t : terms) {
      String expr = resolveSqlExpr(t.column());
      String dir = t.direction() == OrderTerm.Direction.DESC ? " DESC" : " ASC";
      parts.add(t.nullCheck() ? "(" + expr + " IS NULL)" + dir : expr + dir);
    }
    return new SqlStatement(base.sql() + " ORDER BY " + String.join(", ", parts), base.binds());
  }

  /** ANSI row limiting; dialects override (Postgres LIMIT, etc.). */
  protected SqlStatement applyLimit(SqlStatement base, int limit) {
    return new SqlStatement(base.sql() + " FETCH FIRST " + limit + " ROWS ONLY", base.binds());
  }

  /** Quotes each segment of {@code column} or {@code table.column}. */
  protected String resolveSqlExpr(String column) {
    String[] segments = column.split("\\.", -1);
    List<String> quoted = new ArrayList<>(segments.length);
    for (String s : segments) {
      if (s.isEmpty()) throw new IllegalArgumentException("Invalid column identifier '" + column + "'");
      quoted.add(quoteIdent(s));
    }
    return String.join(".", quoted);
  }

  private String renderPredicateSql(QueryElement el, RenderCtx ctx, boolean negate) {
    if (el instanceof NotElement n) {
      return renderPredicateSql(n.element(), ctx, !negate);
    }

    if (el instanceof Literal l) {
      return (l.value() ^ negate) ? "TRUE" : "FALSE";
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      if (g.elements().isEmpty()) return clause == Clause.AND ? "TRUE" : "FALSE";
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        childSql.add(renderPredicateSql(c, ctx, negate));
      }
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String expr = resolveSqlExpr(c.property());
    if (c.isNullCheck()) {
      boolean isNull = (c.operator() == Operator.EQ) ^ negate;
      return expr + (isNull ? " IS NULL" : " IS NOT NULL");
    }
    String p = ctx.add(Bind.of(c.value()));
    String sql = expr + " " + c.operator().symbol() + " " + p;
    return negate ? "NOT (" + sql + ")" : sql;
  }

  /**
   * Offset of the outermost {@code WHERE} keyword, ignoring quoted text and parenthesized
   * subqueries, or -1.
   */
  static int topLevelWhere(String sql) {
    String lower = sql.toLowerCase(Locale.ROOT);
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < lower.length(); i++) {
      char ch = lower.charAt(i);
      if (quote != 0) {
        if (ch == quote) quote = 0;
        continue;
      }
      switch (ch) {
        case '\'', '"' -> quote = ch;
        case '(' -> depth++;
        case ')' -> depth--;
        default -> {
          if (depth == 0 && lower.startsWith("where", i) && boundary(lower, i - 1) && boundary(lower, i + 5)) {
            return i;
          }
        }
      }
    }
    return -1;
  }

  private static boolean boundary(String s, int i) {
    if (i < 0 || i >= s.length()) return true;
    char c = s.charAt(i);
    return !(Character.isLetterOrDigit(c) || c == '_');
  }

  protected abstract String quoteIdent(String ident);
}
