package io.intellixity.paginator.error;

import java.util.Map;

/** Raised the first time a paginator is asked for a sort it does not declare. */
public final class UnknownSortException extends PaginatorException {
  private final String sort;

  public UnknownSortException(String sort) {
    super("Unknown sort: '" + sort + "'", Map.of("sort", String.valueOf(sort)));
    this.sort = sort;
  }

  public String sort() {
    return sort;
  }
}
