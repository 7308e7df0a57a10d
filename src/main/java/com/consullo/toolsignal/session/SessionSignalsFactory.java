package com.consullo.toolsignal.session;

import com.consullo.toolsignal.core.TerminalGrid;
import com.consullo.toolsignal.watch.ActivityEventWatcher;
import com.consullo.toolsignal.watch.InputWaitWatcher;
import com.consullo.toolsignal.watch.ModeModelWatcher;
import com.consullo.toolsignal.watch.PromptVisibilityWatcher;
import com.consullo.toolsignal.watch.WatcherConfig;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.Validate;

/**
 * Factory for session signals with sensible defaults.
 *
 * <p>
 * Centralizes:
 * <ul>
 * <li>the delivery executor (one daemon thread, so listeners see changes in order)</li>
 * <li>the polling scheduler (two daemon threads)</li>
 * <li>the four watcher configurations</li>
 * </ul>
 * Executors created here live for the life of the JVM; callers that need a bounded lifetime pass their own.
 * </p>
 */
public final class SessionSignalsFactory {

  private static final int SCHEDULER_THREADS = 2;

  private static volatile ExecutorService defaultDelivery;
  private static volatile ScheduledExecutorService defaultScheduler;

  private SessionSignalsFactory() {
  }

  /**
   * Attach signals to a grid using the shared default executors and default configurations.
   *
   * @param grid grid to watch
   * @return attached session signals
   */
  public static SessionSignals createDefault(final TerminalGrid grid) {
    return create(grid, defaultDeliveryExecutor(), defaultScheduler(), Clock.systemUTC());
  }

  /**
   * Attach signals to a grid using caller-supplied executors and default configurations.
   *
   * @param grid grid to watch
   * @param deliveryExecutor context listeners are notified on
   * @param scheduler scheduler for the polling watchers; not shut down by the session
   * @param clock clock stamped on activity events
   * @return attached session signals
   */
  public static SessionSignals create(
          final TerminalGrid grid,
          final Executor deliveryExecutor,
          final ScheduledExecutorService scheduler,
          final Clock clock) {
    return create(grid, deliveryExecutor, scheduler, clock,
            WatcherConfig.inputWait(), WatcherConfig.modeModel(),
            WatcherConfig.promptVisibility(), WatcherConfig.activity());
  }

  /**
   * Attach signals to a grid with every setting overridden.
   *
   * @param grid grid to watch
   * @param deliveryExecutor context listeners are notified on
   * @param scheduler scheduler for the polling watchers
   * @param clock clock stamped on activity events
   * @param inputWaitConfig input-wait window
   * @param modeModelConfig mode/model window
   * @param promptVisibilityConfig prompt window and poll period
   * @param activityConfig activity poll period
   * @return attached session signals
   */
  public static SessionSignals create(
          final TerminalGrid grid,
          final Executor deliveryExecutor,
          final ScheduledExecutorService scheduler,
          final Clock clock,
          final WatcherConfig inputWaitConfig,
          final WatcherConfig modeModelConfig,
          final WatcherConfig promptVisibilityConfig,
          final WatcherConfig activityConfig) {
    Validate.notNull(grid, "grid must not be null");

    return SessionSignals.attach(
            grid,
            new InputWaitWatcher(inputWaitConfig, deliveryExecutor),
            new ModeModelWatcher(modeModelConfig, deliveryExecutor),
            new PromptVisibilityWatcher(promptVisibilityConfig, scheduler, deliveryExecutor),
            new ActivityEventWatcher(activityConfig, scheduler, deliveryExecutor, clock));
  }

  static synchronized ExecutorService defaultDeliveryExecutor() {
    if (defaultDelivery == null) {
      defaultDelivery = Executors.newSingleThreadExecutor(daemonThreads("SignalDelivery"));
    }
    return defaultDelivery;
  }

  static synchronized ScheduledExecutorService defaultScheduler() {
    if (defaultScheduler == null) {
      defaultScheduler = Executors.newScheduledThreadPool(SCHEDULER_THREADS, daemonThreads("SignalPoll"));
    }
    return defaultScheduler;
  }

  private static ThreadFactory daemonThreads(final String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
