package io.intellixity.paginator.sort;

import io.intellixity.paginator.error.ConfigurationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Date;
import java.util.Locale;
import java.util.Map;

/** Declared type of a sort column; decides which cursor values are acceptable for it. */
public enum ColumnType {
  STRING("string"),
  INTEGER("integer"),
  FLOAT("float"),
  BOOLEAN("boolean"),
  DATE("date");

  private final String id;

  ColumnType(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /**
   * Checks the shape of a non-null value against this type.
   * Never throws; a value of the wrong shape simply yields {@code false}.
   */
  public boolean check(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case INTEGER -> isInteger(value);
      case FLOAT -> isFinite(value);
      case BOOLEAN -> value instanceof Boolean;
      case DATE -> value instanceof Date || value instanceof Temporal || value instanceof String;
    };
  }

  public static ColumnType fromId(String id) {
    if (id != null) {
      String key = id.trim().toLowerCase(Locale.ROOT);
      for (ColumnType t : values()) {
        if (t.id.equals(key)) return t;
      }
    }
    throw new ConfigurationException("Unknown column type '" + id + "'",
        Map.of("columnType", String.valueOf(id), "known", Arrays.stream(values()).map(ColumnType::id).toList()));
  }

  private static boolean isInteger(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte
        || v instanceof BigInteger) {
      return true;
    }
    if (v instanceof BigDecimal bd) {
      return bd.signum() == 0 || bd.stripTrailingZeros().scale() <= 0;
    }
    if (v instanceof Double || v instanceof Float) {
      double d = ((Number) v).doubleValue();
      return Double.isFinite(d) && d == Math.rint(d);
    }
    return false;
  }

  private static boolean isFinite(Object v) {
    if (v instanceof Double || v instanceof Float) return Double.isFinite(((Number) v).doubleValue());
    return v instanceof Number;
  }
}
