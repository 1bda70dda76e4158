package io.intellixity.paginator.paginator;

import io.intellixity.paginator.chain.BoundaryChain;
import io.intellixity.paginator.chain.BoundaryChainCache;
import io.intellixity.paginator.cursor.ArgsFingerprint;
import io.intellixity.paginator.cursor.Cursor;
import io.intellixity.paginator.cursor.CursorCodec;
import io.intellixity.paginator.error.InvalidCursorException;
import io.intellixity.paginator.error.PaginatorException;
import io.intellixity.paginator.exec.PageSpec;
import io.intellixity.paginator.exec.QueryExecutor;
import io.intellixity.paginator.mapping.RowAccessor;
import io.intellixity.paginator.query.QueryElement;
import io.intellixity.paginator.sort.SortDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Template for one paginated query.\n
 *
 * Subclasses declare:\n
 * - {@link #sorts()}: the named sorts the query supports (static per class)\n
 * - {@link #baseQuery(Object)}: the application query for the given arguments\n
 * - optionally {@link #queryName()}, {@link #varyArgs()} and, for typed rows, {@link #rowAccessor()}\n
 *
 * {@link #getPage(PageRequest, Object)} compiles the sort once per class, validates the client
 * cursor, runs the page and, for full pages, the remaining count, then mints the next cursor.\n
 *
 * @param <Q> base query type understood by the executor
 * @param <T> row type
 * @param <A> argument type
 */
public abstract class Paginator<Q, T, A> {
  private static final Logger log = LoggerFactory.getLogger(Paginator.class);
  private static final BoundaryChainCache CHAINS = new BoundaryChainCache();

  private final QueryExecutor<Q, T> executor;

  protected Paginator(QueryExecutor<Q, T> executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /** Sort name to columns. Read once per class and sort; must not change at runtime. */
  protected abstract Map<String, List<SortDescriptor>> sorts();

  protected abstract Q baseQuery(A args);

  /** Identity written into cursors; cursors of another query are rejected. */
  public String queryName() {
    String simple = getClass().getSimpleName();
    return simple.isEmpty() ? getClass().getName() : simple;
  }

  /** Reads sort values from rows; the default walks map-shaped rows by value path. */
  protected RowAccessor<? super T> rowAccessor() {
    return RowAccessor.paths();
  }

  /** Top-level argument names that may change between pages without invalidating the cursor. */
  protected Collection<String> varyArgs() {
    return Set.of();
  }

  /** Compiled chain of {@code sort}; fails with {@code UnknownSortException} for undeclared sorts. */
  public final BoundaryChain chain(String sort) {
    return CHAINS.get(getClass(), sort, this::sorts);
  }

  public final Page<T> getPage(PageRequest request, A args) {
    Objects.requireNonNull(request, "request");
    String query = queryName();
    String sort = request.sort();
    BoundaryChain chain = chain(sort);
    String argsHash = ArgsFingerprint.of(args, varyArgs());

    Cursor cursor = CursorCodec.decode(request.cursor());
    if (cursor != null) checkIdentity(cursor, query, sort, argsHash);
    QueryElement boundary = (cursor != null && cursor.hasBoundary()) ? chain.applyBoundary(cursor.values()) : null;

    Q base = baseQuery(args);
    int limit = request.limit();
    List<T> items = executor.select(base, new PageSpec(chain.orderTerms(), boundary, limit));

    long remaining = 0;
    if (items.size() == limit) {
      remaining = Math.max(0, executor.count(base, boundary) - items.size());
    }

    String next;
    if (!items.isEmpty()) {
      List<Object> values = chain.extractBoundary(items.get(items.size() - 1), rowAccessor());
      next = CursorCodec.encode(new Cursor(query, sort, argsHash, values));
    } else if (cursor == null) {
      next = CursorCodec.encode(Cursor.start(query, sort, argsHash));
    } else {
      next = request.cursor();
    }

    if (log.isDebugEnabled()) {
      log.debug("paginator.page query={} sort={} limit={} boundary={} items={} remaining={}",
          query, sort, limit, boundary != null, items.size(), remaining);
    }
    return new Page<>(items, remaining, next);
  }

  private static void checkIdentity(Cursor cursor, String query, String sort, String argsHash) {
    if (!query.equals(cursor.queryId())) {
      throw new InvalidCursorException("Cursor is for a different query",
          Map.of("cursorQuery", cursor.queryId(), "expectedQuery", query));
    }
    if (!sort.equals(cursor.sortId())) {
      throw new InvalidCursorException("Cursor is for a different sort",
          Map.of("cursorSort", cursor.sortId(), "expectedSort", sort));
    }
    if (!Objects.equals(argsHash, cursor.argsFingerprint())) {
      throw new InvalidCursorException("Args hash mismatch", PaginatorException.details("expectedArgs", argsHash));
    }
  }
}
