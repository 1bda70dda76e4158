package io.intellixity.paginator.exec;

import io.intellixity.paginator.query.OrderTerm;
import io.intellixity.paginator.query.QueryElement;

import java.util.List;
import java.util.Objects;

/**
 * What an executor adds to the base query for one page.
 *
 * @param orderTerms ordering, applied in list order
 * @param boundary rows to keep, or {@code null} on the first page
 * @param limit maximum number of rows
 */
public record PageSpec(List<OrderTerm> orderTerms, QueryElement boundary, int limit) {
  public PageSpec {
    orderTerms = List.copyOf(Objects.requireNonNull(orderTerms, "orderTerms"));
    if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
  }

  public boolean hasBoundary() {
    return boundary != null;
  }
}
