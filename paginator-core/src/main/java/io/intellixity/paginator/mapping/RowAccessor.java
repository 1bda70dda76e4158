package io.intellixity.paginator.mapping;

/**
 * Read-side accessor for result rows.\n
 *
 * Typed rows get hand-written or generated implementations (no reflection); map rows use
 * {@link #paths()}.\n
 */
@FunctionalInterface
public interface RowAccessor<T> {
  /** Value at {@code path} (a sort column's value path), or {@code null} when absent. */
  Object get(T row, String path);

  /** Dot paths over maps, lists and arrays; see {@link RowValues}. */
  static <T> RowAccessor<T> paths() {
    return RowValues::read;
  }
}
