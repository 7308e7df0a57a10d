package com.consullo.toolsignal.scan;

import java.util.HashMap;
import java.util.Map;

/**
 * Last-seen text per grid row, keyed by row index.
 *
 * <p>Owned by exactly one scanning context; not thread-safe. Rows at or past the current row count are pruned after
 * each scan. A watcher gets a fresh cache on every attach.
 *
 * @since 1.0
 */
public final class RowTextCache {

  private final Map<Integer, String> lastSeen = new HashMap<>();

  /**
   * Returns the cached text for a row, or the empty string if the row has never been seen.
   *
   * @param row row index
   * @return cached text
   */
  public String get(final int row) {
    return lastSeen.getOrDefault(row, "");
  }

  void put(final int row, final String text) {
    lastSeen.put(row, text);
  }

  void pruneFrom(final int rowCount) {
    lastSeen.keySet().removeIf(row -> row >= rowCount);
  }

  /**
   * Returns the number of cached rows.
   *
   * @return cached row count
   */
  public int size() {
    return lastSeen.size();
  }
}
