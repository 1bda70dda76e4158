package io.intellixity.paginator.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Lexical handling of named parameters ({@code :tenantId}) in SQL text.\n
 *
 * Rules:\n
 * - a parameter is ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is a cast, not a parameter\n
 * - text inside single quotes (string literals) and double quotes (identifiers) is skipped\n
 */
public final class NamedParams {
  private NamedParams() {}

  /** Binds for every named parameter of {@code sql}, in order of appearance. Repeated names bind again. */
  public static List<Bind> bindsFor(String sql, Map<String, Object> params) {
    List<Bind> binds = new ArrayList<>();
    if (sql == null) return binds;
    Map<String, Object> effective = (params == null) ? Map.of() : params;
    scan(sql, null, name -> {
      if (!effective.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
      Object raw = effective.get(name);
      binds.add(raw instanceof Bind b ? b : Bind.of(raw));
    });
    return binds;
  }

  /** Rewrites every named parameter to {@code ?}. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    scan(sql, out, name -> out.append('?'));
    return out.toString();
  }

  private static void scan(String sql, StringBuilder out, Consumer<String> onParam) {
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        if (out != null) out.append(ch);
        if (ch == quote) {
          // doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            if (out != null) out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        if (out != null) out.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          if (out != null) out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          onParam.accept(sql.substring(start, end));
          i = end - 1;
          continue;
        }
      }

      if (out != null) out.append(ch);
    }
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
