package io.intellixity.paginator.sort;

import java.util.Objects;

/**
 * A sort column as declared by the application; everything but the column is optional.
 *
 * <p>Type and direction are kept as ids so that declarations read from configuration are
 * validated at normalization, the same way as the ones written in code.</p>
 *
 * <pre>{@code
 * SortDescriptor.of("people.created_at").withType(ColumnType.DATE).withDirection("desc")
 * }</pre>
 */
public record SortDescriptor(
    String column,
    String type,
    Boolean nullable,
    String direction,
    String valuePath,
    CursorValueValidator validator) {

  public SortDescriptor {
    Objects.requireNonNull(column, "column");
  }

  public static SortDescriptor of(String column) {
    return new SortDescriptor(column, null, null, null, null, null);
  }

  public SortDescriptor withType(String type) {
    return new SortDescriptor(column, type, nullable, direction, valuePath, validator);
  }

  public SortDescriptor withType(ColumnType type) {
    return withType(type.id());
  }

  public SortDescriptor withNullable(boolean nullable) {
    return new SortDescriptor(column, type, nullable, direction, valuePath, validator);
  }

  public SortDescriptor asNullable() {
    return withNullable(true);
  }

  public SortDescriptor withDirection(String direction) {
    return new SortDescriptor(column, type, nullable, direction, valuePath, validator);
  }

  public SortDescriptor withDirection(SortDirection direction) {
    return withDirection(direction.id());
  }

  public SortDescriptor withValuePath(String valuePath) {
    return new SortDescriptor(column, type, nullable, direction, valuePath, validator);
  }

  public SortDescriptor withValidator(CursorValueValidator validator) {
    return new SortDescriptor(column, type, nullable, direction, valuePath, validator);
  }
}
