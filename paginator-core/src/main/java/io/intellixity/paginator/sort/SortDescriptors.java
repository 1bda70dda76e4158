package io.intellixity.paginator.sort;

import java.util.List;
import java.util.Objects;

/** Normalization of raw sort declarations. */
public final class SortDescriptors {
  private SortDescriptors() {}

  public static NormalizedSortDescriptor normalize(String column) {
    return normalize(SortDescriptor.of(column));
  }

  /**
   * Applies defaults: type {@code string}, not nullable, direction {@code asc}, value path = column.
   *
   * @throws io.intellixity.paginator.error.ConfigurationException on an unknown type or direction
   *     or a malformed column identifier
   */
  public static NormalizedSortDescriptor normalize(SortDescriptor d) {
    Objects.requireNonNull(d, "descriptor");
    ColumnIdentifier column = ColumnIdentifier.parse(d.column());
    ColumnType type = d.type() == null ? ColumnType.STRING : ColumnType.fromId(d.type());
    SortDirection direction = d.direction() == null ? SortDirection.ASCENDING : SortDirection.fromId(d.direction());
    String valuePath = (d.valuePath() == null || d.valuePath().isBlank()) ? d.column() : d.valuePath();
    return new NormalizedSortDescriptor(column, type, Boolean.TRUE.equals(d.nullable()), direction,
        valuePath, d.validator());
  }

  public static List<NormalizedSortDescriptor> normalizeAll(List<SortDescriptor> descriptors) {
    return descriptors.stream().map(SortDescriptors::normalize).toList();
  }
}
