package com.consullo.toolsignal.scan;

import com.consullo.toolsignal.core.TerminalGrid;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.apache.commons.lang3.Validate;

/**
 * Determines which grid rows changed since the previous scan.
 *
 * <p>Each row is read exactly once per scan and its text is handed back with the change, so callers never re-read a
 * row that may have been rewritten in between. A row that the grid cannot currently supply ({@code null}) is skipped
 * and keeps its cached text. A row never seen before counts as changed only if it is non-empty.
 *
 * @since 1.0
 */
public final class BufferScanner {

  private BufferScanner() {
  }

  /**
   * Scans every visible row of a grid.
   *
   * @param grid grid to read
   * @param cache caller-owned cache, updated in place
   * @return changed rows in ascending row order
   */
  public static List<ChangedRow> scan(final TerminalGrid grid, final RowTextCache cache) {
    Validate.notNull(grid, "grid must not be null");
    return scan(grid.rows(), grid::lineAt, cache);
  }

  /**
   * Scans rows {@code 0..rows-1} through an arbitrary row accessor.
   *
   * @param rows current row count
   * @param lineAt row accessor; may return null for an unavailable row
   * @param cache caller-owned cache, updated in place and pruned to {@code rows}
   * @return changed rows in ascending row order
   */
  public static List<ChangedRow> scan(final int rows, final IntFunction<String> lineAt, final RowTextCache cache) {
    Validate.notNull(lineAt, "lineAt must not be null");
    Validate.notNull(cache, "cache must not be null");

    List<ChangedRow> changed = new ArrayList<>();
    for (int row = 0; row < rows; row++) {
      String text = lineAt.apply(row);
      if (text == null) {
        continue;
      }
      if (text.equals(cache.get(row))) {
        continue;
      }
      cache.put(row, text);
      changed.add(new ChangedRow(row, text));
    }

    cache.pruneFrom(Math.max(rows, 0));
    return changed;
  }
}
