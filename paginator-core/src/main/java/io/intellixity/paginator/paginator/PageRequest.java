package io.intellixity.paginator.paginator;

/** Client side of a page request. A non-positive limit means {@link #DEFAULT_LIMIT}. */
public record PageRequest(int limit, String sort, String cursor) {
  public static final int DEFAULT_LIMIT = 1000;
  public static final String DEFAULT_SORT = "default";

  public PageRequest {
    limit = limit > 0 ? limit : DEFAULT_LIMIT;
    sort = (sort == null || sort.isBlank()) ? DEFAULT_SORT : sort;
  }

  public static PageRequest first() {
    return new PageRequest(0, null, null);
  }

  public static PageRequest of(int limit, String sort) {
    return new PageRequest(limit, sort, null);
  }

  public PageRequest withLimit(int limit) { return new PageRequest(limit, sort, cursor); }
  public PageRequest withSort(String sort) { return new PageRequest(limit, sort, cursor); }
  public PageRequest withCursor(String cursor) { return new PageRequest(limit, sort, cursor); }

  /** Request for the page after {@code page}, keeping limit and sort. */
  public PageRequest next(Page<?> page) {
    return withCursor(page.cursor());
  }
}
