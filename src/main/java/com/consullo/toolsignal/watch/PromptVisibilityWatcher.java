package com.consullo.toolsignal.watch;

import com.consullo.toolsignal.scan.RowText;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the bottom rows for the agent's own input prompt ({@code >} or {@code > text}), i.e. whether the agent has
 * returned control to the user.
 *
 * @since 1.0
 */
public final class PromptVisibilityWatcher extends AbstractPollingWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(PromptVisibilityWatcher.class);

  private volatile boolean promptVisible;
  private volatile Consumer<Boolean> listener;

  public PromptVisibilityWatcher(final ScheduledExecutorService scheduler, final Executor deliveryExecutor) {
    this(WatcherConfig.promptVisibility(), scheduler, deliveryExecutor);
  }

  public PromptVisibilityWatcher(
          final WatcherConfig config,
          final ScheduledExecutorService scheduler,
          final Executor deliveryExecutor) {
    super("PromptVisibilityWatcher", config, scheduler, deliveryExecutor);
  }

  public void setListener(final Consumer<Boolean> listener) {
    this.listener = listener;
  }

  public boolean isPromptVisible() {
    return promptVisible;
  }

  @Override
  protected void poll(final Attachment a) {
    int rows = a.grid().rows();
    boolean visible = false;
    for (int row = config().windowStart(rows); row < rows; row++) {
      if (isAgentPrompt(a.grid().lineAt(row))) {
        visible = true;
        break;
      }
    }

    if (visible == promptVisible) {
      return;
    }
    promptVisible = visible;
    LOGGER.debug("promptVisible -> {}", visible);
    deliver(a, listener, visible);
  }

  /**
   * Returns true for a line whose trimmed text is exactly {@code ">"} or starts with {@code "> "}.
   *
   * @param line line text, may be null
   * @return true for the agent's input prompt
   */
  public static boolean isAgentPrompt(final String line) {
    String trimmed = RowText.trim(line);
    return trimmed.equals(">") || trimmed.startsWith("> ");
  }
}
