package io.intellixity.paginator.mapping;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;

/**
 * Reads values out of map-shaped result rows by dot path.\n
 *
 * Path segments are resolved against:\n
 * - {@link Map} keys\n
 * - {@link List} / array indexes (numeric segments, e.g. {@code memberships.0.role})\n
 *
 * A segment that cannot be resolved yields {@code null}; absent and null are not distinguished.
 * Typed rows are read through a {@link RowAccessor} instead.\n
 */
public final class RowValues {
  private RowValues() {}

  public static Object read(Object row, String path) {
    if (path == null || path.isBlank()) return row;
    Object cur = row;
    for (String segment : path.split("\\.")) {
      if (cur == null) return null;
      cur = segment(cur, segment, path);
    }
    return cur;
  }

  private static Object segment(Object cur, String name, String path) {
    if (cur instanceof Map<?, ?> m) return m.get(name);
    if (cur instanceof List<?> l) {
      int i = index(name);
      return (i < 0 || i >= l.size()) ? null : l.get(i);
    }
    if (cur.getClass().isArray()) {
      int i = index(name);
      return (i < 0 || i >= Array.getLength(cur)) ? null : Array.get(cur, i);
    }
    throw new IllegalArgumentException("Cannot resolve '" + path + "' on " + cur.getClass().getName()
        + "; typed rows need a RowAccessor");
  }

  private static int index(String segment) {
    if (segment.isEmpty()) return -1;
    for (int i = 0; i < segment.length(); i++) {
      if (!Character.isDigit(segment.charAt(i))) return -1;
    }
    try {
      return Integer.parseInt(segment);
    } catch (NumberFormatException e) {
      return -1;
    }
  }
}
