package com.consullo.toolsignal.watch;

import org.apache.commons.lang3.Validate;

/**
 * Watcher configuration values.
 *
 * @param scanWindowRows number of bottom rows to scan; {@link #ALL_ROWS} scans the whole grid
 * @param pollIntervalMillis poll period for timer-driven watchers; ignored by signal-driven watchers
 * @since 1.0
 */
public record WatcherConfig(
    int scanWindowRows,
    long pollIntervalMillis) {

  public static final int ALL_ROWS = 0;

  public static final long DEFAULT_POLL_INTERVAL_MILLIS = 500L;

  public WatcherConfig {
    Validate.isTrue(scanWindowRows >= 0, "scanWindowRows must not be negative");
    Validate.isTrue(pollIntervalMillis >= 0, "pollIntervalMillis must not be negative");
  }

  public static WatcherConfig inputWait() {
    return new WatcherConfig(5, 0L);
  }

  public static WatcherConfig modeModel() {
    return new WatcherConfig(8, 0L);
  }

  public static WatcherConfig promptVisibility() {
    return new WatcherConfig(10, DEFAULT_POLL_INTERVAL_MILLIS);
  }

  public static WatcherConfig activity() {
    return new WatcherConfig(ALL_ROWS, DEFAULT_POLL_INTERVAL_MILLIS);
  }

  /**
   * Returns the first row of the bottom scan window for a grid of {@code rows} rows.
   *
   * @param rows current row count
   * @return first row to scan (inclusive)
   */
  public int windowStart(int rows) {
    if (scanWindowRows == ALL_ROWS) {
      return 0;
    }
    return Math.max(0, rows - scanWindowRows);
  }
}
