package com.consullo.toolsignal.watch;

import com.consullo.toolsignal.scan.BufferScanner;
import com.consullo.toolsignal.scan.ChangedRow;
import com.consullo.toolsignal.scan.RowText;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the whole grid for rows that changed since the previous poll and turns each recognized line into an
 * {@link ActivityEvent} (file read, command run, or agent status).
 *
 * <p>Only changed rows are classified, so a line that stays on screen is reported once. Events are delivered in row
 * order, one enqueue per event.
 *
 * @since 1.0
 */
public final class ActivityEventWatcher extends AbstractPollingWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActivityEventWatcher.class);

  private final Clock clock;

  private volatile Consumer<ActivityEvent> listener;

  public ActivityEventWatcher(final ScheduledExecutorService scheduler, final Executor deliveryExecutor) {
    this(WatcherConfig.activity(), scheduler, deliveryExecutor, Clock.systemUTC());
  }

  public ActivityEventWatcher(
          final WatcherConfig config,
          final ScheduledExecutorService scheduler,
          final Executor deliveryExecutor,
          final Clock clock) {
    super("ActivityEventWatcher", config, scheduler, deliveryExecutor);
    Validate.notNull(clock, "clock must not be null");
    this.clock = clock;
  }

  public void setListener(final Consumer<ActivityEvent> listener) {
    this.listener = listener;
  }

  @Override
  protected void poll(final Attachment a) {
    List<ChangedRow> changed = BufferScanner.scan(a.grid(), a.rowCache());
    if (changed.isEmpty()) {
      return;
    }
    LOGGER.debug("{} changed rows", changed.size());

    Instant now = clock.instant();
    for (ChangedRow row : changed) {
      String clean = RowText.clean(row.text());
      if (clean.isEmpty()) {
        continue;
      }
      Optional<ActivityEvent> event = AgentLineClassifier.classify(clean, now);
      if (event.isPresent()) {
        deliver(a, listener, event.get());
      }
    }
  }
}
