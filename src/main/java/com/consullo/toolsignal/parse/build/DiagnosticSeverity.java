package com.consullo.toolsignal.parse.build;

import java.util.Locale;

/**
 * Severity level of a build diagnostic.
 *
 * @since 1.0
 */
public enum DiagnosticSeverity {
  ERROR,
  WARNING,
  NOTE;

  /**
   * Maps a tool's severity word to a level, case-insensitively. Unknown or missing words map to {@link #ERROR}.
   *
   * @param token severity word as printed by the tool
   * @return severity level
   */
  public static DiagnosticSeverity fromToken(final String token) {
    if (token == null) {
      return ERROR;
    }
    switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "warning":
        return WARNING;
      case "note":
      case "remark":
        return NOTE;
      default:
        return ERROR;
    }
  }
}
