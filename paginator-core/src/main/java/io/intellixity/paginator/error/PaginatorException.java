package io.intellixity.paginator.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every failure raised by the paginator.
 *
 * <p>{@link #info()} carries the structured detail of the failure (offending values, expected vs.
 * actual identities). It is meant for logs and diagnostics, not for clients.</p>
 */
public class PaginatorException extends RuntimeException {
  private final Map<String, Object> info;

  public PaginatorException(String message) {
    this(message, Map.of(), null);
  }

  public PaginatorException(String message, Map<String, ?> info) {
    this(message, info, null);
  }

  public PaginatorException(String message, Map<String, ?> info, Throwable cause) {
    super(message, cause);
    // null values are legal here, e.g. {value: null}
    this.info = Collections.unmodifiableMap(new LinkedHashMap<>(info == null ? Map.of() : info));
  }

  public Map<String, Object> info() {
    return info;
  }

  /** Builds an info map from alternating keys and values; values may be null. */
  public static Map<String, Object> details(Object... keyValues) {
    if (keyValues.length % 2 != 0) throw new IllegalArgumentException("keyValues must be key/value pairs");
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return out;
  }
}
