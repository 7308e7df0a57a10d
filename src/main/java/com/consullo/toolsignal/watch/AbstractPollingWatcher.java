package com.consullo.toolsignal.watch;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watcher driven by its own fixed-period timer. Attaching schedules the timer; detaching cancels it.
 *
 * <p>The scheduler is supplied by the caller and is not shut down by the watcher. Polls are serialized on a
 * per-watcher lock, so a timer tick and a caller's {@link #pollNow()} never touch poll state at the same time.
 *
 * @since 1.0
 */
public abstract class AbstractPollingWatcher extends AbstractGridWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPollingWatcher.class);

  private final WatcherConfig config;
  private final ScheduledExecutorService scheduler;
  private final Object pollLock = new Object();

  private ScheduledFuture<?> timer;

  protected AbstractPollingWatcher(
          final String name,
          final WatcherConfig config,
          final ScheduledExecutorService scheduler,
          final Executor deliveryExecutor) {
    super(name, deliveryExecutor);
    Validate.notNull(config, "config must not be null");
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.isTrue(config.pollIntervalMillis() > 0, "pollIntervalMillis must be positive for polling watchers");
    this.config = config;
    this.scheduler = scheduler;
  }

  public final WatcherConfig config() {
    return config;
  }

  /**
   * Runs one poll synchronously on the calling thread against the current attachment, waiting for any poll already
   * in progress. A detached watcher is a no-op.
   */
  public final void pollNow() {
    synchronized (pollLock) {
      Attachment a = currentAttachment();
      if (a == null) {
        return;
      }
      try {
        poll(a);
      } catch (RuntimeException e) {
        // Never rethrow: an escaping exception cancels the fixed-rate task.
        LOGGER.debug("{} skipped a tick: grid unavailable ({})", name(), e.getMessage());
      }
    }
  }

  /**
   * Reads the grid once and reports changed values.
   *
   * @param a attachment to read from
   */
  protected abstract void poll(Attachment a);

  @Override
  protected final void onAttach(final Attachment a) {
    long period = config.pollIntervalMillis();
    timer = scheduler.scheduleAtFixedRate(this::pollNow, period, period, TimeUnit.MILLISECONDS);
  }

  @Override
  protected final void onDetach(final Attachment a) {
    if (timer != null) {
      timer.cancel(false);
      timer = null;
    }
  }
}
