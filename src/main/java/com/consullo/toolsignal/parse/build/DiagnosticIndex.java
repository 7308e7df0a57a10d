package com.consullo.toolsignal.parse.build;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Looks up the diagnostics that belong to one file, keyed by line, for inline annotation.
 *
 * @since 1.0
 */
public final class DiagnosticIndex {

  private DiagnosticIndex() {
  }

  /**
   * Returns the diagnostics reported against one file.
   *
   * <p>An absolute reported path must equal {@code absolutePath}. A relative reported path must equal
   * {@code relativePath} or be a trailing path portion of it. When several diagnostics share a line, the last wins.
   *
   * @param diagnostics parsed diagnostics
   * @param absolutePath absolute path of the file
   * @param relativePath path of the file relative to the project root
   * @return line to diagnostic, in output order
   */
  public static Map<Integer, Diagnostic> forFile(
          final List<Diagnostic> diagnostics,
          final String absolutePath,
          final String relativePath) {
    Validate.notNull(diagnostics, "diagnostics must not be null");
    Validate.notNull(absolutePath, "absolutePath must not be null");
    Validate.notNull(relativePath, "relativePath must not be null");

    Map<Integer, Diagnostic> byLine = new LinkedHashMap<>();
    for (Diagnostic d : diagnostics) {
      if (matches(d.filePath(), absolutePath, relativePath)) {
        byLine.put(d.line(), d);
      }
    }
    return byLine;
  }

  static boolean matches(final String reported, final String absolutePath, final String relativePath) {
    if (reported.startsWith("/")) {
      return reported.equals(absolutePath);
    }
    return reported.equals(relativePath) || relativePath.endsWith("/" + reported);
  }
}
