package com.consullo.toolsignal.parse.build;

import org.apache.commons.lang3.Validate;

/**
 * A single located compiler or type-checker message.
 *
 * @param filePath file path as reported by the tool, relative or absolute
 * @param line 1-based line number
 * @param column 1-based column number, or null when the tool did not report one
 * @param severity severity level
 * @param message message text
 * @since 1.0
 */
public record Diagnostic(
    String filePath,
    int line,
    Integer column,
    DiagnosticSeverity severity,
    String message) {

  public Diagnostic {
    Validate.notBlank(filePath, "filePath must not be blank");
    Validate.isTrue(line >= 1, "line must be >= 1 (was %d)", line);
    Validate.isTrue(column == null || column >= 1, "column must be >= 1 (was %s)", column);
    Validate.notNull(severity, "severity must not be null");
    Validate.notNull(message, "message must not be null");
  }
}
