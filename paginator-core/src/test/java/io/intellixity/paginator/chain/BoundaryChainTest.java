package io.intellixity.paginator.chain;

import io.intellixity.paginator.error.ConfigurationException;
import io.intellixity.paginator.error.InvalidCursorException;
import io.intellixity.paginator.query.Literal;
import io.intellixity.paginator.query.OrderTerm;
import io.intellixity.paginator.query.QueryElement;
import io.intellixity.paginator.sort.ColumnType;
import io.intellixity.paginator.sort.NormalizedSortDescriptor;
import io.intellixity.paginator.sort.SortDescriptor;
import io.intellixity.paginator.sort.SortDescriptors;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.paginator.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class BoundaryChainTest {
  private static NormalizedSortDescriptor col(SortDescriptor d) {
    return SortDescriptors.normalize(d);
  }

  @Test
  void requiresAtLeastOneColumn() {
    ConfigurationException e = assertThrows(ConfigurationException.class, () -> BoundaryChain.of(List.of()));
    assertEquals("A sort requires at least one column", e.getMessage());
  }

  @Test
  void tailSharesPositions() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("a")),
        col(SortDescriptor.of("b").asNullable()),
        col(SortDescriptor.of("c")));
    assertEquals(3, chain.size());
    assertTrue(chain.anyNullable());

    BoundaryChain tail = chain.tail();
    assertEquals("b", tail.head().column());
    assertTrue(tail.anyNullable());
    assertFalse(tail.tail().anyNullable());
    assertNull(tail.tail().tail());
  }

  @Test
  void orderTermsWithoutNullableColumns() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("role").withDirection("desc")),
        col(SortDescriptor.of("id")));
    assertEquals(List.of(
        OrderTerm.value("role", OrderTerm.Direction.DESC),
        OrderTerm.value("id", OrderTerm.Direction.ASC)), chain.orderTerms());
    assertEquals("role desc, id asc", chain.orderByClause());
  }

  @Test
  void orderTermsDoubleWhenAnyColumnIsNullable() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("score").asNullable().withDirection("desc-nulls-last")),
        col(SortDescriptor.of("name").withDirection("desc")),
        col(SortDescriptor.of("id")));
    List<OrderTerm> terms = chain.orderTerms();
    assertEquals(6, terms.size());
    assertEquals(OrderTerm.isNull("score", OrderTerm.Direction.ASC), terms.get(0));
    assertEquals(OrderTerm.value("score", OrderTerm.Direction.DESC), terms.get(1));
    assertEquals(OrderTerm.isNull("name", OrderTerm.Direction.DESC), terms.get(2));
    assertEquals("(score is null) asc, score desc, (name is null) desc, name desc, (id is null) asc, id asc",
        chain.orderByClause());
  }

  @Test
  void tieBreakPredicate() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("role")),
        col(SortDescriptor.of("id").withType(ColumnType.INTEGER)));

    QueryElement p = chain.applyBoundary(List.of("admin", 17));
    assertEquals(or(gt("role", "admin"), and(eq("role", "admin"), gt("id", 17))), p);
  }

  @Test
  void tieBreakAcrossFourColumns() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("role")),
        col(SortDescriptor.of("firstName")),
        col(SortDescriptor.of("lastName")),
        col(SortDescriptor.of("id").withType(ColumnType.INTEGER)));

    QueryElement p = chain.applyBoundary(List.of("admin", "Dude", "Bro", 3));
    assertEquals(
        or(gt("role", "admin"), and(eq("role", "admin"),
            or(gt("firstName", "Dude"), and(eq("firstName", "Dude"),
                or(gt("lastName", "Bro"), and(eq("lastName", "Bro"), gt("id", 3))))))),
        p);
  }

  @Test
  void descendingTieBreakUsesLessThan() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("created_at").withType("date").withDirection("desc")),
        col(SortDescriptor.of("id").withType("integer").withDirection("desc")));

    QueryElement p = chain.applyBoundary(List.of("2024-01-02T00:00:00Z", 9));
    Instant at = Instant.parse("2024-01-02T00:00:00Z");
    assertEquals(or(lt("created_at", at), and(eq("created_at", at), lt("id", 9))), p);
  }

  @Test
  void nullsLastSingleColumnNullBoundarySelectsNothing() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("score").withType("integer").asNullable().withDirection("desc-nulls-last")));
    assertEquals(Literal.FALSE, chain.applyBoundary(Arrays.asList((Object) null)));
  }

  @Test
  void nullsFirstSingleColumnNullBoundarySelectsNonNulls() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("score").withType("integer").asNullable().withDirection("desc")));
    assertEquals(isNotNull("score"), chain.applyBoundary(Arrays.asList((Object) null)));
  }

  @Test
  void nullBoundaryWithTail() {
    BoundaryChain last = BoundaryChain.of(
        col(SortDescriptor.of("score").withType("integer").asNullable()),
        col(SortDescriptor.of("id").withType("integer")));
    assertEquals(and(isNull("score"), gt("id", 4)), last.applyBoundary(Arrays.asList(null, 4)));

    BoundaryChain first = BoundaryChain.of(
        col(SortDescriptor.of("score").withType("integer").asNullable().withDirection("desc")),
        col(SortDescriptor.of("id").withType("integer")));
    assertEquals(or(isNotNull("score"), and(isNull("score"), gt("id", 4))),
        first.applyBoundary(Arrays.asList(null, 4)));
  }

  @Test
  void nullableNullsLastValueAlsoSelectsNulls() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("score").withType("integer").asNullable()),
        col(SortDescriptor.of("id").withType("integer")));
    assertEquals(or(or(gt("score", 3), isNull("score")), and(eq("score", 3), gt("id", 4))),
        chain.applyBoundary(List.of(3, 4)));
  }

  @Test
  void tooFewValues() {
    BoundaryChain chain = BoundaryChain.of(col(SortDescriptor.of("a")), col(SortDescriptor.of("b")));
    InvalidCursorException e = assertThrows(InvalidCursorException.class, () -> chain.applyBoundary(List.of("x")));
    assertEquals("Cursor has too few values", e.getMessage());
    assertEquals(Map.of("expected", 2, "actual", 1), e.info());
  }

  @Test
  void extraValuesAreIgnored() {
    BoundaryChain chain = BoundaryChain.of(col(SortDescriptor.of("a")));
    assertEquals(gt("a", "x"), chain.applyBoundary(List.of("x", "y")));
  }

  @Test
  void cursorValuesAreValidated() {
    BoundaryChain chain = BoundaryChain.of(col(SortDescriptor.of("id").withType("integer")));
    InvalidCursorException e = assertThrows(InvalidCursorException.class, () -> chain.applyBoundary(List.of("1")));
    assertEquals("Cursor value does not match its column type", e.getMessage());
  }

  @Test
  void extractsBoundaryInChainOrder() {
    BoundaryChain chain = BoundaryChain.of(
        col(SortDescriptor.of("score").withType("integer").asNullable()),
        col(SortDescriptor.of("id").withType("integer")));
    Map<String, Object> row = new HashMap<>();
    row.put("id", 3);
    row.put("score", null);
    assertEquals(Arrays.asList(null, 3), chain.extractBoundary(row));

    row.remove("id");
    assertThrows(ConfigurationException.class, () -> chain.extractBoundary(row));
  }
}
