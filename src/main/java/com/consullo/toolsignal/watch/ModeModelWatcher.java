package com.consullo.toolsignal.watch;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects the agent's current operating mode and active model name from status and prompt lines near the bottom of
 * the grid. Mode and model are tracked and reported independently.
 *
 * @since 1.0
 */
public final class ModeModelWatcher extends AbstractSignalWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModeModelWatcher.class);

  private static final List<String> MODE_WORDS = List.of("interactive", "ask", "plan", "autopilot", "agent");

  // Longest first, so "using model: " wins over "model: ".
  private static final List<String> MODEL_PREFIXES = List.of("using model: ", "using model:", "model: ", "model:");

  private static final String MODEL_PUNCTUATION = ".,;)>";

  private volatile AgentMode currentMode;
  private volatile String currentModel;

  private volatile Consumer<AgentMode> modeListener;
  private volatile Consumer<String> modelListener;

  public ModeModelWatcher(final Executor deliveryExecutor) {
    this(WatcherConfig.modeModel(), deliveryExecutor);
  }

  public ModeModelWatcher(final WatcherConfig config, final Executor deliveryExecutor) {
    super("ModeModelWatcher", config, deliveryExecutor);
  }

  public void setModeListener(final Consumer<AgentMode> modeListener) {
    this.modeListener = modeListener;
  }

  public void setModelListener(final Consumer<String> modelListener) {
    this.modelListener = modelListener;
  }

  public Optional<AgentMode> currentMode() {
    return Optional.ofNullable(currentMode);
  }

  public Optional<String> currentModel() {
    return Optional.ofNullable(currentModel);
  }

  @Override
  protected void scanWindow(final Attachment a, final int startRow, final int endRow) {
    for (int row = startRow; row < endRow; row++) {
      String text = a.grid().lineAt(row);
      if (text == null || text.isEmpty()) {
        continue;
      }

      AgentMode mode = detectMode(text).orElse(null);
      if (mode != null && mode != currentMode) {
        currentMode = mode;
        LOGGER.debug("mode -> {} (row {})", mode, row);
        deliver(a, modeListener, mode);
      }

      String model = detectModel(text).orElse(null);
      if (model != null && !Objects.equals(model, currentModel)) {
        currentModel = model;
        LOGGER.debug("model -> {} (row {})", model, row);
        deliver(a, modelListener, model);
      }
    }
  }

  /**
   * Recognizes a mode indicator: a tag such as {@code (plan)} or {@code [autopilot]}, a status line such as
   * {@code mode: plan}, or a transition line such as {@code switched to plan mode}.
   *
   * @param text line text
   * @return detected mode, or empty when the line carries no mode indicator
   */
  public static Optional<AgentMode> detectMode(final String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String word : MODE_WORDS) {
      if (lower.contains("(" + word + ")") || lower.contains("[" + word + "]")) {
        return AgentMode.fromToken(word);
      }
    }
    for (String word : MODE_WORDS) {
      if (lower.contains("mode: " + word) || lower.contains("mode:" + word)) {
        return AgentMode.fromToken(word);
      }
    }
    for (String word : MODE_WORDS) {
      if (lower.contains("switched to " + word)) {
        return AgentMode.fromToken(word);
      }
    }
    return Optional.empty();
  }

  /**
   * Extracts a model name following {@code using model:} or {@code model:} (case-insensitive): the next
   * whitespace-delimited token with surrounding {@code . , ; ) >} removed.
   *
   * @param text line text
   * @return model name, or empty when none is present
   */
  public static Optional<String> detectModel(final String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    for (String prefix : MODEL_PREFIXES) {
      int idx = StringUtils.indexOfIgnoreCase(text, prefix);
      if (idx < 0) {
        continue;
      }
      String rest = text.substring(idx + prefix.length()).trim();
      String token = rest.isEmpty() ? "" : rest.split("\\s+", 2)[0];
      String model = StringUtils.strip(token, MODEL_PUNCTUATION);
      if (StringUtils.isNotEmpty(model)) {
        return Optional.of(model);
      }
    }
    return Optional.empty();
  }
}
