package com.consullo.toolsignal.parse.build;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One single-line diagnostic convention: a regex and the extractor that turns a match into a {@link Diagnostic}.
 * The extractor returns null when a captured value is unusable (e.g. line 0), which rejects only that line.
 *
 * @param name convention name, for logging
 * @param pattern line pattern
 * @param extractor match to diagnostic, or null
 * @since 1.0
 */
public record DiagnosticPattern(
    String name,
    Pattern pattern,
    Function<Matcher, Diagnostic> extractor) {

  /**
   * Applies this pattern to one line.
   *
   * @param line line text
   * @return diagnostic, or null when the line does not match or its captures are unusable
   */
  public Diagnostic apply(final String line) {
    Matcher m = pattern.matcher(line);
    if (!m.find()) {
      return null;
    }
    return extractor.apply(m);
  }
}
