package com.consullo.toolsignal.parse.build;

import com.consullo.toolsignal.parse.LineSupport;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses combined build output into located {@link Diagnostic}s.
 *
 * <p>Supported conventions, tried per line in this order:
 * <ul>
 * <li>Swift, GCC, Clang: {@code path:line:col: severity: message}</li>
 * <li>TypeScript: {@code path(line,col): severity TSxxxx: message}</li>
 * <li>Cargo/rustc: a {@code severity[Exxxx]: message} header followed by a {@code --> path:line:col} line</li>
 * </ul>
 * The column is optional in every form. Only entries with a resolvable location are returned.
 *
 * <p>Stateless and thread-safe.
 *
 * @since 1.0
 */
public final class BuildDiagnosticParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(BuildDiagnosticParser.class);

  private static final String SEVERITY = "(fatal error|error|warning|note|remark)";

  static final List<DiagnosticPattern> SINGLE_LINE_PATTERNS = List.of(
          new DiagnosticPattern(
                  "gcc",
                  Pattern.compile("^(.+?):(\\d+)(?::(\\d+))?:\\s*" + SEVERITY + ":\\s*(.+)$"),
                  BuildDiagnosticParser::located),
          new DiagnosticPattern(
                  "tsc",
                  Pattern.compile("^(.+?)\\((\\d+)(?:,(\\d+))?\\):\\s*(error|warning)\\s+\\S+:\\s*(.+)$"),
                  BuildDiagnosticParser::located));

  private static final Pattern RUST_HEADER = Pattern.compile("^(error|warning)(?:\\[E\\d+\\])?:\\s*(.+)$");

  private static final Pattern RUST_ARROW = Pattern.compile("^\\s*-->\\s+(.+?):(\\d+)(?::(\\d+))?\\s*$");

  private record PendingHeader(DiagnosticSeverity severity, String message) {
  }

  private BuildDiagnosticParser() {
  }

  /**
   * Parses all lines of a build output blob.
   *
   * @param output combined stdout and stderr, may be null
   * @return diagnostics in output order; empty when none are recognized
   */
  public static List<Diagnostic> parse(final String output) {
    List<Diagnostic> result = new ArrayList<>();
    PendingHeader pending = null;

    for (String line : LineSupport.lines(output)) {
      Diagnostic single = matchSingleLine(line);
      if (single != null) {
        result.add(single);
        pending = null;
        continue;
      }

      Matcher header = RUST_HEADER.matcher(line);
      if (header.find()) {
        String message = header.group(2).trim();
        pending = message.isEmpty()
                ? null
                : new PendingHeader(DiagnosticSeverity.fromToken(header.group(1)), message);
        continue;
      }

      if (pending != null) {
        Diagnostic arrow = matchArrow(line, pending);
        if (arrow != null) {
          result.add(arrow);
          pending = null;
          continue;
        }
        String trimmed = line.trim();
        if (!trimmed.isEmpty() && !trimmed.startsWith("-->") && !trimmed.startsWith("= ")) {
          pending = null;
        }
      }
    }

    LOGGER.debug("parsed {} diagnostics", result.size());
    return List.copyOf(result);
  }

  private static Diagnostic matchSingleLine(final String line) {
    for (DiagnosticPattern p : SINGLE_LINE_PATTERNS) {
      Diagnostic d = p.apply(line);
      if (d != null) {
        return d;
      }
    }
    return null;
  }

  private static Diagnostic matchArrow(final String line, final PendingHeader pending) {
    Matcher m = RUST_ARROW.matcher(line);
    if (!m.find()) {
      return null;
    }
    Integer ln = LineSupport.parseIntOrNull(m.group(2));
    if (ln == null || ln < 1) {
      return null;
    }
    String path = m.group(1).trim();
    if (path.isEmpty()) {
      return null;
    }
    return new Diagnostic(path, ln, column(m.group(3)), pending.severity(), pending.message());
  }

  // Groups: 1 path, 2 line, 3 optional column, 4 severity, 5 message.
  private static Diagnostic located(final Matcher m) {
    Integer ln = LineSupport.parseIntOrNull(m.group(2));
    if (ln == null || ln < 1) {
      return null;
    }
    String path = m.group(1).trim();
    String message = m.group(5).trim();
    if (path.isEmpty() || message.isEmpty()) {
      return null;
    }
    return new Diagnostic(path, ln, column(m.group(3)), DiagnosticSeverity.fromToken(m.group(4)), message);
  }

  // A reported column of 0 carries no position.
  private static Integer column(final String token) {
    Integer col = LineSupport.parseIntOrNull(token);
    return col == null || col < 1 ? null : col;
  }
}
