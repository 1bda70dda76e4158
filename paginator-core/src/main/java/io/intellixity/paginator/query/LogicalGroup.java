package io.intellixity.paginator.query;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record LogicalGroup(Clause clause, List<QueryElement> elements) implements QueryElement {
  public LogicalGroup {
    Objects.requireNonNull(clause, "clause");
    elements = List.copyOf(elements == null ? List.of() : elements);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    if (elements.isEmpty()) return clause == Clause.AND ? "TRUE" : "FALSE";
    String sep = " " + clause.name() + " ";
    return elements.stream().map(e -> "(" + e + ")").collect(Collectors.joining(sep));
  }
}
