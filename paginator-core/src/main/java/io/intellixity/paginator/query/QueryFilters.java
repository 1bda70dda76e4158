package io.intellixity.paginator.query;

import java.util.List;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return new Condition(property, Operator.EQ, value); }
  public static Condition ne(String property, Object value) { return new Condition(property, Operator.NE, value); }
  public static Condition gt(String property, Object value) { return new Condition(property, Operator.GT, value); }
  public static Condition ge(String property, Object value) { return new Condition(property, Operator.GE, value); }
  public static Condition lt(String property, Object value) { return new Condition(property, Operator.LT, value); }
  public static Condition le(String property, Object value) { return new Condition(property, Operator.LE, value); }

  public static Condition compare(String property, Operator operator, Object value) {
    return new Condition(property, operator, value);
  }

  public static Condition isNull(String property) { return new Condition(property, Operator.EQ, null); }
  public static Condition isNotNull(String property) { return new Condition(property, Operator.NE, null); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  public static Literal none() { return Literal.FALSE; }
  public static Literal all() { return Literal.TRUE; }
}
