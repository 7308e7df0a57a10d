package com.consullo.toolsignal.session;

import com.consullo.toolsignal.core.TerminalGrid;
import com.consullo.toolsignal.watch.AbstractGridWatcher;
import com.consullo.toolsignal.watch.ActivityEvent;
import com.consullo.toolsignal.watch.ActivityEventWatcher;
import com.consullo.toolsignal.watch.InputWaitWatcher;
import com.consullo.toolsignal.watch.ModeModelWatcher;
import com.consullo.toolsignal.watch.PromptVisibilityWatcher;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All derived signals for one terminal session.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the four watchers, attached to one grid</li>
 * <li>the latest {@link WatcherState}</li>
 * <li>an ordered queue of {@link ActivityEvent}s</li>
 * </ul>
 * State updates and the state listener run on the delivery executor the watchers were built with.
 *
 * @since 1.0
 */
public final class SessionSignals implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionSignals.class);

  private final TerminalGrid grid;
  private final InputWaitWatcher inputWait;
  private final ModeModelWatcher modeModel;
  private final PromptVisibilityWatcher promptVisibility;
  private final ActivityEventWatcher activity;

  private final AtomicReference<WatcherState> state = new AtomicReference<>(WatcherState.initial());
  private final BlockingQueue<ActivityEvent> activityQueue = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile Consumer<WatcherState> stateListener;

  private SessionSignals(
          final TerminalGrid grid,
          final InputWaitWatcher inputWait,
          final ModeModelWatcher modeModel,
          final PromptVisibilityWatcher promptVisibility,
          final ActivityEventWatcher activity) {
    this.grid = grid;
    this.inputWait = inputWait;
    this.modeModel = modeModel;
    this.promptVisibility = promptVisibility;
    this.activity = activity;
  }

  /**
   * Wires the watchers' listeners and attaches all four to {@code grid}.
   *
   * @param grid grid to watch
   * @param inputWait input-wait watcher
   * @param modeModel mode/model watcher
   * @param promptVisibility prompt-visibility watcher
   * @param activity activity watcher
   * @return attached session signals
   */
  public static SessionSignals attach(
          final TerminalGrid grid,
          final InputWaitWatcher inputWait,
          final ModeModelWatcher modeModel,
          final PromptVisibilityWatcher promptVisibility,
          final ActivityEventWatcher activity) {
    Validate.notNull(grid, "grid must not be null");
    Validate.notNull(inputWait, "inputWait must not be null");
    Validate.notNull(modeModel, "modeModel must not be null");
    Validate.notNull(promptVisibility, "promptVisibility must not be null");
    Validate.notNull(activity, "activity must not be null");

    SessionSignals s = new SessionSignals(grid, inputWait, modeModel, promptVisibility, activity);

    inputWait.setListener(v -> s.update(st -> st.withWaitingForInput(v)));
    modeModel.setModeListener(m -> s.update(st -> st.withMode(m)));
    modeModel.setModelListener(m -> s.update(st -> st.withModel(m)));
    promptVisibility.setListener(v -> s.update(st -> st.withPromptVisible(v)));
    activity.setListener(s.activityQueue::add);

    for (AbstractGridWatcher w : List.of(inputWait, modeModel, promptVisibility, activity)) {
      w.attach(grid);
    }
    LOGGER.info("Session signals attached ({} rows)", grid.rows());
    return s;
  }

  public TerminalGrid grid() {
    return grid;
  }

  public WatcherState state() {
    return state.get();
  }

  public BlockingQueue<ActivityEvent> activityQueue() {
    return activityQueue;
  }

  public void setStateListener(final Consumer<WatcherState> stateListener) {
    this.stateListener = stateListener;
  }

  public InputWaitWatcher inputWaitWatcher() {
    return inputWait;
  }

  public ModeModelWatcher modeModelWatcher() {
    return modeModel;
  }

  public PromptVisibilityWatcher promptVisibilityWatcher() {
    return promptVisibility;
  }

  public ActivityEventWatcher activityEventWatcher() {
    return activity;
  }

  /**
   * Runs one poll of both timer-driven watchers on the calling thread.
   */
  public void pollNow() {
    promptVisibility.pollNow();
    activity.pollNow();
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void update(final UnaryOperator<WatcherState> change) {
    WatcherState next = state.updateAndGet(change);
    Consumer<WatcherState> l = stateListener;
    if (l != null) {
      l.accept(next);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    inputWait.close();
    modeModel.close();
    promptVisibility.close();
    activity.close();
    LOGGER.info("Session signals closed");
  }
}
