package io.intellixity.paginator.jdbc;

import java.time.temporal.Temporal;
import java.util.Date;
import java.util.UUID;

/**
 * One positional bind value.
 *
 * @param value value passed to the driver, possibly {@code null}
 * @param typeId coarse type of the value, used in logs instead of the value itself
 */
public record Bind(Object value, String typeId) {
  public static Bind of(Object v) {
    if (v == null) return new Bind(null, "null");
    if (v instanceof String) return new Bind(v, "string");
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) return new Bind(v, "integer");
    if (v instanceof Number) return new Bind(v, "number");
    if (v instanceof Boolean) return new Bind(v, "bool");
    if (v instanceof UUID) return new Bind(v, "uuid");
    if (v instanceof Temporal || v instanceof Date) return new Bind(v, "temporal");
    return new Bind(v, "object");
  }
}
