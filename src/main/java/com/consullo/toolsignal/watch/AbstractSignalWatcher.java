package com.consullo.toolsignal.watch;

import com.consullo.toolsignal.core.TerminalGrid;
import com.consullo.toolsignal.core.events.RangeChangedEvent;
import com.consullo.toolsignal.core.events.RangeChangedListener;
import java.util.concurrent.Executor;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watcher driven by the grid's range-changed notifications. It re-scans a bottom window of rows only when a
 * notification touches that window.
 *
 * <p>Notifications arrive serially on the grid writer's context; derived state is written only from there.
 *
 * @since 1.0
 */
public abstract class AbstractSignalWatcher extends AbstractGridWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractSignalWatcher.class);

  private final WatcherConfig config;
  private final RangeChangedListener rangeListener = this::onRangeChanged;

  protected AbstractSignalWatcher(final String name, final WatcherConfig config, final Executor deliveryExecutor) {
    super(name, deliveryExecutor);
    Validate.notNull(config, "config must not be null");
    Validate.isTrue(config.scanWindowRows() > 0, "signal watchers need a bounded scan window");
    this.config = config;
  }

  public final WatcherConfig config() {
    return config;
  }

  /**
   * Handles a range-changed notification. Also callable directly by a host that receives notifications itself.
   *
   * @param event changed rows
   */
  public final void onRangeChanged(final RangeChangedEvent event) {
    Attachment a = currentAttachment();
    if (a == null || event == null) {
      return;
    }
    try {
      int rows = a.grid().rows();
      if (rows <= 0) {
        return;
      }
      int start = config.windowStart(rows);
      if (!event.intersects(start, rows)) {
        return;
      }
      scanWindow(a, start, rows);
    } catch (RuntimeException e) {
      LOGGER.debug("{} skipped rows [{}, {}): grid unavailable ({})", name(), event.startRow(), event.endRow(),
              e.getMessage());
    }
  }

  /**
   * Re-scans the bottom window and reports changed values.
   *
   * @param a attachment to read from
   * @param startRow first row of the window (inclusive)
   * @param endRow end of the window (exclusive)
   */
  protected abstract void scanWindow(Attachment a, int startRow, int endRow);

  @Override
  protected final void onAttach(final Attachment a) {
    a.grid().addRangeChangedListener(rangeListener);
  }

  @Override
  protected final void onDetach(final Attachment a) {
    TerminalGrid grid = a.grid();
    grid.removeRangeChangedListener(rangeListener);
  }
}
