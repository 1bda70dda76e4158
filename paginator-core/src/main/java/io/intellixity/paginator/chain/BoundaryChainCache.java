package io.intellixity.paginator.chain;

import io.intellixity.paginator.error.UnknownSortException;
import io.intellixity.paginator.sort.SortDescriptor;
import io.intellixity.paginator.sort.SortDescriptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Write-once cache of compiled chains keyed by (owner, sort name).
 *
 * <p>Chains are built outside any lock and published with {@code putIfAbsent}; two threads racing
 * on the same key may both build, and every reader sees the first published chain. Unknown sorts
 * are not cached, so the failure repeats on every lookup.</p>
 */
public final class BoundaryChainCache {
  private static final Logger log = LoggerFactory.getLogger(BoundaryChainCache.class);

  private final Map<Key, BoundaryChain> chains = new ConcurrentHashMap<>();

  public BoundaryChain get(Class<?> owner, String sort, Supplier<Map<String, List<SortDescriptor>>> sorts) {
    Key key = new Key(owner, sort);
    BoundaryChain cached = chains.get(key);
    if (cached != null) return cached;

    List<SortDescriptor> declared = sorts.get().get(sort);
    if (declared == null) throw new UnknownSortException(sort);
    BoundaryChain built = BoundaryChain.of(SortDescriptors.normalizeAll(declared));

    BoundaryChain prior = chains.putIfAbsent(key, built);
    if (prior != null) return prior;
    if (log.isDebugEnabled()) {
      log.debug("paginator.chain compiled owner={} sort={} columns={} nullable={}",
          owner.getSimpleName(), sort, built.size(), built.anyNullable());
    }
    return built;
  }

  public int size() {
    return chains.size();
  }

  private record Key(Class<?> owner, String sort) {
    Key {
      Objects.requireNonNull(owner, "owner");
      Objects.requireNonNull(sort, "sort");
    }
  }
}
