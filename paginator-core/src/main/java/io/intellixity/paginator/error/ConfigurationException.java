package io.intellixity.paginator.error;

import java.util.Map;

/**
 * Raised when a sort declaration is malformed, or when a value read from a server-side row does not
 * satisfy the descriptor it was declared with. Either way it is a developer/deployment defect.
 */
public final class ConfigurationException extends PaginatorException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Map<String, ?> info) {
    super(message, info);
  }

  public ConfigurationException(String message, Map<String, ?> info, Throwable cause) {
    super(message, info, cause);
  }
}
