package com.consullo.toolsignal.core.events;

import java.time.Instant;

/**
 * Describes a region of the terminal grid that was re-rendered.
 *
 * <p>The damage model is coarse: a half-open range of changed rows, or a full redraw (clear screen, resize).
 *
 * @param timestampUtc event timestamp in UTC
 * @param startRow first changed row (inclusive)
 * @param endRow last changed row (exclusive)
 * @param fullRedraw true when every row should be considered changed
 * @since 1.0
 */
public record RangeChangedEvent(
    Instant timestampUtc,
    int startRow,
    int endRow,
    boolean fullRedraw) {

  /**
   * Creates a full-redraw event.
   *
   * @return full redraw event
   */
  public static RangeChangedEvent createFullRedraw() {
    return new RangeChangedEvent(Instant.now(), 0, Integer.MAX_VALUE, true);
  }

  /**
   * Creates a partial event for the specified row range.
   *
   * @param startRow first changed row (inclusive)
   * @param endRow last changed row (exclusive)
   * @return partial event
   */
  public static RangeChangedEvent rows(int startRow, int endRow) {
    return new RangeChangedEvent(Instant.now(), startRow, endRow, false);
  }

  /**
   * Returns true when this event touches any row in {@code [fromRow, toRow)}.
   *
   * @param fromRow first row of the window (inclusive)
   * @param toRow end of the window (exclusive)
   * @return true if the ranges overlap
   */
  public boolean intersects(int fromRow, int toRow) {
    if (fullRedraw) {
      return true;
    }
    return startRow < toRow && endRow > fromRow;
  }
}
