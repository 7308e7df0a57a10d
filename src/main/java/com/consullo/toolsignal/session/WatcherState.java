package com.consullo.toolsignal.session;

import com.consullo.toolsignal.watch.AgentMode;

/**
 * Immutable snapshot of every derived signal for one session. Replaced wholesale on each delivered change.
 *
 * @param waitingForInput agent is blocked on a prompt
 * @param mode last detected mode, or null before any detection
 * @param model last detected model name, or null before any detection
 * @param promptVisible agent's own input prompt is on screen
 * @since 1.0
 */
public record WatcherState(
    boolean waitingForInput,
    AgentMode mode,
    String model,
    boolean promptVisible) {

  private static final WatcherState INITIAL = new WatcherState(false, null, null, false);

  public static WatcherState initial() {
    return INITIAL;
  }

  public WatcherState withWaitingForInput(final boolean value) {
    return new WatcherState(value, mode, model, promptVisible);
  }

  public WatcherState withMode(final AgentMode value) {
    return new WatcherState(waitingForInput, value, model, promptVisible);
  }

  public WatcherState withModel(final String value) {
    return new WatcherState(waitingForInput, mode, value, promptVisible);
  }

  public WatcherState withPromptVisible(final boolean value) {
    return new WatcherState(waitingForInput, mode, model, value);
  }
}
