package com.consullo.toolsignal.core.memory;

import com.consullo.toolsignal.core.TerminalGrid;
import com.consullo.toolsignal.core.events.RangeChangedEvent;
import com.consullo.toolsignal.core.events.RangeChangedListener;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple in-memory grid for hosts that render text themselves, and for tests.
 *
 * <p>The grid has a single writer: the thread calling the mutators. Every mutation fires a
 * {@link RangeChangedEvent} on that thread after the rows have been updated. Reads may come from any thread.
 *
 * @since 1.0
 */
public final class InMemoryTerminalGrid implements TerminalGrid {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTerminalGrid.class);

  private final Object lock = new Object();
  private final List<RangeChangedListener> listeners = new ArrayList<>();

  private String[] lines;

  /**
   * Creates a blank grid.
   *
   * @param rows number of visible rows
   */
  public InMemoryTerminalGrid(final int rows) {
    Validate.isTrue(rows > 0, "rows must be positive");
    this.lines = new String[rows];
    Arrays.fill(this.lines, "");
  }

  @Override
  public int rows() {
    synchronized (lock) {
      return lines.length;
    }
  }

  @Override
  public String lineAt(final int row) {
    synchronized (lock) {
      if (row < 0 || row >= lines.length) {
        return null;
      }
      return lines[row];
    }
  }

  @Override
  public void addRangeChangedListener(final RangeChangedListener listener) {
    Validate.notNull(listener, "listener must not be null");
    synchronized (lock) {
      listeners.add(listener);
    }
  }

  @Override
  public void removeRangeChangedListener(final RangeChangedListener listener) {
    synchronized (lock) {
      listeners.remove(listener);
    }
  }

  /**
   * Replaces the text of one row.
   *
   * @param row row index
   * @param text new text (null is stored as blank)
   */
  public void setLine(final int row, final String text) {
    synchronized (lock) {
      Validate.isTrue(row >= 0 && row < lines.length, "row out of range: %d", row);
      lines[row] = rightTrim(text);
    }
    fire(RangeChangedEvent.rows(row, row + 1));
  }

  /**
   * Writes consecutive rows starting at {@code startRow}. Rows past the bottom of the grid are dropped.
   *
   * @param startRow first row to write
   * @param texts row texts
   */
  public void setLines(final int startRow, final List<String> texts) {
    Validate.notNull(texts, "texts must not be null");
    int end;
    synchronized (lock) {
      Validate.isTrue(startRow >= 0 && startRow < lines.length, "startRow out of range: %d", startRow);
      end = Math.min(lines.length, startRow + texts.size());
      for (int row = startRow; row < end; row++) {
        lines[row] = rightTrim(texts.get(row - startRow));
      }
    }
    if (end > startRow) {
      fire(RangeChangedEvent.rows(startRow, end));
    }
  }

  /**
   * Fills the grid from the bottom up so that the last entry of {@code texts} lands on the last row, blanking
   * everything above. Handy for simulating output that has scrolled to the cursor line.
   *
   * @param texts row texts, oldest first
   */
  public void showAtBottom(final List<String> texts) {
    Validate.notNull(texts, "texts must not be null");
    synchronized (lock) {
      Arrays.fill(lines, "");
      int offset = lines.length - texts.size();
      for (int i = 0; i < texts.size(); i++) {
        int row = offset + i;
        if (row >= 0) {
          lines[row] = rightTrim(texts.get(i));
        }
      }
    }
    fire(RangeChangedEvent.createFullRedraw());
  }

  /**
   * Blanks every row.
   */
  public void clear() {
    synchronized (lock) {
      Arrays.fill(lines, "");
    }
    fire(RangeChangedEvent.createFullRedraw());
  }

  /**
   * Changes the number of visible rows, keeping the top rows.
   *
   * @param rows new row count
   */
  public void resize(final int rows) {
    Validate.isTrue(rows > 0, "rows must be positive");
    synchronized (lock) {
      String[] resized = Arrays.copyOf(lines, rows);
      for (int i = lines.length; i < rows; i++) {
        resized[i] = "";
      }
      lines = resized;
    }
    fire(RangeChangedEvent.createFullRedraw());
  }

  private void fire(final RangeChangedEvent event) {
    List<RangeChangedListener> copy;
    synchronized (lock) {
      copy = new ArrayList<>(listeners);
    }
    for (RangeChangedListener listener : copy) {
      try {
        listener.onRangeChanged(event);
      } catch (RuntimeException e) {
        LOGGER.warn("Range listener failed for rows [{}, {}): {}", event.startRow(), event.endRow(), e.getMessage(), e);
      }
    }
  }

  private static String rightTrim(final String s) {
    if (s == null) {
      return "";
    }
    int n = s.length();
    while (n > 0) {
      char c = s.charAt(n - 1);
      if (c == ' ' || c == '\0' || c == '\t') {
        n--;
      } else {
        break;
      }
    }
    return n == s.length() ? s : s.substring(0, n);
  }
}
