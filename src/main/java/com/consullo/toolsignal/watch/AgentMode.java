package com.consullo.toolsignal.watch;

import java.util.Locale;
import java.util.Optional;

/**
 * Operating modes of an interactive coding agent.
 *
 * <p>Declaration order is the cycling order used by {@link #next()}.
 */
public enum AgentMode {

  INTERACTIVE("interactive", "Interactive"),
  PLAN("plan", "Plan"),
  AUTOPILOT("autopilot", "Autopilot");

  private final String token;
  private final String displayName;

  AgentMode(String token, String displayName) {
    this.token = token;
    this.displayName = displayName;
  }

  /**
   * The lower-case token the agent prints for this mode.
   *
   * @return mode token
   */
  public String token() {
    return token;
  }

  /**
   * Label suitable for a toolbar or status bar.
   *
   * @return display name
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Terminal input that switches the agent into this mode.
   *
   * @return command text including the trailing newline
   */
  public String activateCommand() {
    return "/agent " + token + "\n";
  }

  /**
   * Returns the next mode in cycling order, wrapping around.
   *
   * @return successor mode
   */
  public AgentMode next() {
    AgentMode[] all = values();
    return all[(ordinal() + 1) % all.length];
  }

  /**
   * Maps a mode word to a mode, case-insensitively. {@code ask} is an alias for {@link #INTERACTIVE} and {@code agent}
   * an alias for {@link #AUTOPILOT}.
   *
   * @param word mode word
   * @return the mode, or empty if the word is not recognized
   */
  public static Optional<AgentMode> fromToken(String word) {
    if (word == null) {
      return Optional.empty();
    }
    switch (word.trim().toLowerCase(Locale.ROOT)) {
      case "interactive":
      case "ask":
        return Optional.of(INTERACTIVE);
      case "plan":
        return Optional.of(PLAN);
      case "autopilot":
      case "agent":
        return Optional.of(AUTOPILOT);
      default:
        return Optional.empty();
    }
  }
}
