package com.consullo.toolsignal.watch;

import com.consullo.toolsignal.scan.RowText;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects when an interactive agent is blocked waiting for user input (plan approval, y/n confirmation, a clarifying
 * question).
 *
 * <p>The agent is considered waiting when the bottom rows contain an interactive prompt line and no spinner glyph.
 * The value is re-evaluated on every range change touching those rows, so it clears as soon as new output arrives.
 *
 * @since 1.0
 */
public final class InputWaitWatcher extends AbstractSignalWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(InputWaitWatcher.class);

  // Matched against lower-cased text, so each entry covers its Y/N case variants.
  private static final List<String> CONFIRMATION_SUFFIXES = List.of(
          "[y/n]",
          "(y/n)",
          "(yes/no)",
          "[yes/no]",
          "press enter",
          "press any key");

  private volatile boolean waitingForInput;
  private volatile Consumer<Boolean> listener;

  public InputWaitWatcher(final Executor deliveryExecutor) {
    this(WatcherConfig.inputWait(), deliveryExecutor);
  }

  public InputWaitWatcher(final WatcherConfig config, final Executor deliveryExecutor) {
    super("InputWaitWatcher", config, deliveryExecutor);
  }

  /**
   * Sets the listener notified on the delivery executor whenever the waiting state flips.
   *
   * @param listener listener, or null to stop notifications
   */
  public void setListener(final Consumer<Boolean> listener) {
    this.listener = listener;
  }

  public boolean isWaitingForInput() {
    return waitingForInput;
  }

  @Override
  protected void scanWindow(final Attachment a, final int startRow, final int endRow) {
    boolean promptFound = false;
    boolean spinnerFound = false;

    for (int row = startRow; row < endRow; row++) {
      String text = a.grid().lineAt(row);
      if (text == null || text.isEmpty()) {
        continue;
      }
      if (!promptFound && isPromptLine(text)) {
        promptFound = true;
      }
      if (!spinnerFound && SpinnerGlyphs.containsSpinner(text)) {
        spinnerFound = true;
      }
    }

    boolean nowWaiting = promptFound && !spinnerFound;
    if (nowWaiting == waitingForInput) {
      return;
    }
    waitingForInput = nowWaiting;
    LOGGER.debug("waitingForInput -> {} (prompt={}, spinner={})", nowWaiting, promptFound, spinnerFound);
    deliver(a, listener, nowWaiting);
  }

  /**
   * Returns true when {@code text} looks like an interactive prompt: an inquirer-style {@code "? "} line, or a line
   * ending with (or containing, after a space) a confirmation choice such as {@code [y/n]} or {@code press enter}.
   *
   * @param text line text
   * @return true for a prompt line
   */
  public static boolean isPromptLine(final String text) {
    String stripped = RowText.trim(text);
    if (stripped.startsWith("? ")) {
      return true;
    }
    String lower = stripped.toLowerCase(Locale.ROOT);
    for (String suffix : CONFIRMATION_SUFFIXES) {
      if (lower.endsWith(suffix) || lower.contains(" " + suffix)) {
        return true;
      }
    }
    return false;
  }
}
