package io.intellixity.paginator.sort;

import io.intellixity.paginator.error.ConfigurationException;
import io.intellixity.paginator.query.OrderTerm;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Declared direction of a sort column.
 *
 * <p>{@link #ASCENDING} and {@link #DESCENDING_NULLS_LAST} place nulls after every non-null value;
 * {@link #DESCENDING} places them before.</p>
 */
public enum SortDirection {
  ASCENDING("asc", OrderTerm.Direction.ASC, OrderTerm.Direction.ASC),
  DESCENDING("desc", OrderTerm.Direction.DESC, OrderTerm.Direction.DESC),
  DESCENDING_NULLS_LAST("desc-nulls-last", OrderTerm.Direction.DESC, OrderTerm.Direction.ASC);

  private final String id;
  private final OrderTerm.Direction order;
  private final OrderTerm.Direction nullOrder;

  SortDirection(String id, OrderTerm.Direction order, OrderTerm.Direction nullOrder) {
    this.id = id;
    this.order = order;
    this.nullOrder = nullOrder;
  }

  public String id() {
    return id;
  }

  /** Direction of the value term. */
  public OrderTerm.Direction order() {
    return order;
  }

  /** Direction of the {@code (column IS NULL)} term. */
  public OrderTerm.Direction nullOrder() {
    return nullOrder;
  }

  /** {@code (column IS NULL) DESC} puts {@code true} first. */
  public boolean nullsFirst() {
    return nullOrder == OrderTerm.Direction.DESC;
  }

  public static SortDirection fromId(String id) {
    if (id != null) {
      String key = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (SortDirection d : values()) {
        if (d.id.equals(key)) return d;
      }
    }
    throw new ConfigurationException("Unknown sort direction '" + id + "'",
        Map.of("direction", String.valueOf(id), "known", Arrays.stream(values()).map(SortDirection::id).toList()));
  }
}
