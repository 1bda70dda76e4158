package io.intellixity.paginator.sort;

import io.intellixity.paginator.error.ConfigurationException;
import io.intellixity.paginator.error.InvalidCursorException;
import io.intellixity.paginator.error.PaginatorException;

import java.util.Map;

/**
 * Direction of data flow for a cursor value being validated; picks the failure type.
 */
public enum ValidationContext {
  /** Value read from a server-side row while minting a cursor: failures are declaration bugs. */
  CONFIGURATION,
  /** Value taken from a client cursor: failures mean a malformed, tampered or stale cursor. */
  CURSOR;

  public PaginatorException failure(String message, Map<String, ?> info) {
    return switch (this) {
      case CONFIGURATION -> new ConfigurationException(message, info);
      case CURSOR -> new InvalidCursorException(message, info);
    };
  }
}
