package io.intellixity.paginator.paginator;

import java.util.List;

/**
 * One page of results.
 *
 * @param items rows of this page, in sort order
 * @param remaining rows after this page; {@code 0} when the page was not full
 * @param cursor cursor for the next page; never {@code null}
 */
public record Page<T>(List<T> items, long remaining, String cursor) {
  public Page {
    items = List.copyOf(items);
  }

  public boolean hasMore() {
    return remaining > 0;
  }
}
