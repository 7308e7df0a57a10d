package com.consullo.toolsignal.parse;

import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Shared helpers for the line-oriented output parsers.
 *
 * @since 1.0
 */
public final class LineSupport {

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");

  private LineSupport() {
  }

  /**
   * Splits a blob into lines on any line terminator ({@code \n}, {@code \r\n}, {@code \r}).
   *
   * @param output tool output, may be null
   * @return lines; empty for a null or empty blob
   */
  public static List<String> lines(final String output) {
    if (StringUtils.isEmpty(output)) {
      return List.of();
    }
    return List.of(LINE_BREAK.split(output, -1));
  }

  /**
   * Parses a decimal integer capture.
   *
   * @param text captured digits, may be null
   * @return value, or null when absent or out of range
   */
  public static Integer parseIntOrNull(final String text) {
    if (text == null) {
      return null;
    }
    try {
      return Integer.valueOf(text.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Parses a decimal number capture such as {@code 0.02}.
   *
   * @param text captured number, may be null
   * @return value, or null when absent or malformed
   */
  public static Double parseDecimalOrNull(final String text) {
    if (text == null) {
      return null;
    }
    try {
      return Double.valueOf(text.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
