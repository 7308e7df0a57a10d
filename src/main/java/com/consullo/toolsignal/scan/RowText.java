package com.consullo.toolsignal.scan;

import java.util.regex.Pattern;

/**
 * Text normalization helpers for rendered terminal rows.
 *
 * @since 1.0
 */
public final class RowText {

  // ESC followed by a single Fe byte, or a full CSI sequence (parameters, intermediates, final byte).
  private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");

  private RowText() {
  }

  /**
   * Removes ANSI/VT escape sequences.
   *
   * @param s text, may be null
   * @return text without escape sequences (empty for null)
   */
  public static String stripAnsi(final String s) {
    if (s == null || s.isEmpty()) {
      return "";
    }
    if (s.indexOf('\u001B') < 0) {
      return s;
    }
    return ANSI_ESCAPE.matcher(s).replaceAll("");
  }

  /**
   * Trims blanks from both ends, including the NUL characters terminals use for empty cells.
   *
   * @param s text, may be null
   * @return trimmed text (empty for null)
   */
  public static String trim(final String s) {
    if (s == null) {
      return "";
    }
    int start = 0;
    int end = s.length();
    while (start < end && isBlankCell(s.charAt(start))) {
      start++;
    }
    while (end > start && isBlankCell(s.charAt(end - 1))) {
      end--;
    }
    if (start == 0 && end == s.length()) {
      return s;
    }
    return s.substring(start, end);
  }

  /**
   * Strips escape sequences, then trims.
   *
   * @param s raw row text
   * @return clean row text
   */
  public static String clean(final String s) {
    return trim(stripAnsi(s));
  }

  private static boolean isBlankCell(final char c) {
    return c == ' ' || c == '\0' || c == '\t';
  }
}
