package io.intellixity.paginator.sort;

/**
 * Custom check on a non-null cursor value, run after the column type check.
 *
 * <p>Runs both when a value is taken from a row and when it comes back in a client cursor.</p>
 */
@FunctionalInterface
public interface CursorValueValidator {
  ValidationOutcome validate(Object value);

  /** Adapts a plain predicate; failures use {@link ValidationOutcome#DEFAULT_MESSAGE}. */
  static CursorValueValidator of(java.util.function.Predicate<Object> predicate) {
    return v -> ValidationOutcome.of(predicate.test(v));
  }
}
