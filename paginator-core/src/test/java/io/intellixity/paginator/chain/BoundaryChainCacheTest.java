package io.intellixity.paginator.chain;

import io.intellixity.paginator.error.UnknownSortException;
import io.intellixity.paginator.sort.SortDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class BoundaryChainCacheTest {
  private static final Map<String, List<SortDescriptor>> SORTS = Map.of(
      "default", List.of(SortDescriptor.of("id")),
      "byName", List.of(SortDescriptor.of("name"), SortDescriptor.of("id")));

  @Test
  void compilesOncePerOwnerAndSort() {
    BoundaryChainCache cache = new BoundaryChainCache();
    AtomicInteger reads = new AtomicInteger();

    BoundaryChain first = cache.get(String.class, "byName", () -> { reads.incrementAndGet(); return SORTS; });
    BoundaryChain second = cache.get(String.class, "byName", () -> { reads.incrementAndGet(); return SORTS; });
    assertSame(first, second);
    assertEquals(1, reads.get());
    assertEquals(2, first.size());

    BoundaryChain otherOwner = cache.get(Integer.class, "byName", () -> SORTS);
    assertNotSame(first, otherOwner);
    assertEquals(2, cache.size());
  }

  @Test
  void unknownSortIsNotCached() {
    BoundaryChainCache cache = new BoundaryChainCache();
    UnknownSortException e = assertThrows(UnknownSortException.class, () -> cache.get(String.class, "nope", () -> SORTS));
    assertEquals("Unknown sort: 'nope'", e.getMessage());
    assertEquals("nope", e.sort());
    assertEquals(Map.of("sort", "nope"), e.info());
    assertEquals(0, cache.size());
  }
}
