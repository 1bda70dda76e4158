package io.intellixity.paginator.query;

public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
  Q visit(Literal literal);
}
