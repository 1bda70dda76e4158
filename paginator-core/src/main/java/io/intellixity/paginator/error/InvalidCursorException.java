package io.intellixity.paginator.error;

import java.util.Map;

/**
 * Raised when a client-supplied cursor cannot be decoded, belongs to another query/sort/argument set,
 * or carries values that fail validation.
 *
 * <p>Cursor contents are an implementation detail. Clients that alter cursors, or replay a cursor
 * against an unrelated query, end up here; APIs should map it to a client error.</p>
 */
public final class InvalidCursorException extends PaginatorException {
  public InvalidCursorException(String message) {
    super(message);
  }

  public InvalidCursorException(String message, Map<String, ?> info) {
    super(message, info);
  }

  public InvalidCursorException(String message, Map<String, ?> info, Throwable cause) {
    super(message, info, cause);
  }
}
