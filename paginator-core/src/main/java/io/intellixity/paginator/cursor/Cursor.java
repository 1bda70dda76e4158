package io.intellixity.paginator.cursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decoded pagination position.
 *
 * @param queryId identity of the paginated query the cursor was minted for
 * @param sortId sort name the cursor was minted for
 * @param argsFingerprint fingerprint of the query arguments, or {@code null} when there were none
 * @param values boundary values in chain order, or {@code null} for the first page
 */
public record Cursor(String queryId, String sortId, String argsFingerprint, List<Object> values) {
  public Cursor {
    Objects.requireNonNull(queryId, "queryId");
    Objects.requireNonNull(sortId, "sortId");
    // elements may be null
    values = values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static Cursor start(String queryId, String sortId, String argsFingerprint) {
    return new Cursor(queryId, sortId, argsFingerprint, null);
  }

  public boolean hasBoundary() {
    return values != null;
  }
}
