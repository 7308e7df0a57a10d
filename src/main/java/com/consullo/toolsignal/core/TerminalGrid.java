package com.consullo.toolsignal.core;

import com.consullo.toolsignal.core.events.RangeChangedListener;

/**
 * Read-only view over the character grid of an interactive terminal session.
 *
 * <p>This interface isolates the watchers from a specific terminal emulator. The grid has exactly one writer (the
 * emulator that owns it) and any number of concurrent readers. Readers must not assume that a row's text is stable
 * across two reads; every watcher reads each row at most once per scan.
 *
 * @since 1.0
 */
public interface TerminalGrid {

  /**
   * Returns the number of visible rows. Row 0 is the top row.
   *
   * @return visible row count (zero when the grid is detached)
   */
  int rows();

  /**
   * Returns the rendered, printable text of one visible row.
   *
   * @param row row index, 0-based
   * @return row text, right-trimmed, or {@code null} when the row is not currently available
   */
  String lineAt(int row);

  /**
   * Adds a listener that is invoked after new output has been rendered into a range of rows.
   *
   * <p>Notifications are delivered serially on the writer's own execution context.
   *
   * @param listener listener to add
   */
  void addRangeChangedListener(RangeChangedListener listener);

  /**
   * Removes a listener previously added with {@link #addRangeChangedListener(RangeChangedListener)}. Removing an unknown
   * listener is a no-op.
   *
   * @param listener listener to remove
   */
  void removeRangeChangedListener(RangeChangedListener listener);
}
