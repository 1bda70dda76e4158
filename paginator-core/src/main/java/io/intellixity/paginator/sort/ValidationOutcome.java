package io.intellixity.paginator.sort;

import java.util.Objects;

/** Result of a {@link CursorValueValidator}: valid, or invalid with a message. */
public record ValidationOutcome(boolean valid, String message) {
  public static final String DEFAULT_MESSAGE = "Invalid cursor value";

  private static final ValidationOutcome VALID = new ValidationOutcome(true, null);
  private static final ValidationOutcome INVALID = new ValidationOutcome(false, DEFAULT_MESSAGE);

  public ValidationOutcome {
    if (!valid) message = (message == null || message.isBlank()) ? DEFAULT_MESSAGE : message;
    else message = null;
  }

  public static ValidationOutcome ok() { return VALID; }
  public static ValidationOutcome invalid() { return INVALID; }

  public static ValidationOutcome invalid(String message) {
    return new ValidationOutcome(false, Objects.requireNonNull(message, "message"));
  }

  public static ValidationOutcome of(boolean valid) {
    return valid ? VALID : INVALID;
  }
}
