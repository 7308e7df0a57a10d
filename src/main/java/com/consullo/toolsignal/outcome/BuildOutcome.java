package com.consullo.toolsignal.outcome;

import com.consullo.toolsignal.parse.build.BuildDiagnosticParser;
import com.consullo.toolsignal.parse.build.Diagnostic;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Result of one build run: status, the trimmed combined output of a failed run, and its diagnostics.
 *
 * @param status run status
 * @param output trimmed combined output; empty for a passed run
 * @param diagnostics diagnostics parsed from a failed run; empty for a passed run
 * @since 1.0
 */
public record BuildOutcome(
    RunStatus status,
    String output,
    List<Diagnostic> diagnostics) {

  public BuildOutcome {
    Validate.notNull(status, "status must not be null");
    output = StringUtils.defaultString(output);
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  /**
   * Builds the outcome of a finished build process.
   *
   * @param combinedOutput stdout followed by stderr
   * @param exitCode process exit code
   * @return outcome
   */
  public static BuildOutcome fromRun(final String combinedOutput, final int exitCode) {
    if (exitCode == 0) {
      return new BuildOutcome(RunStatus.PASSED, "", List.of());
    }
    String trimmed = StringUtils.trimToEmpty(combinedOutput);
    return new BuildOutcome(RunStatus.FAILED, trimmed, BuildDiagnosticParser.parse(trimmed));
  }

  /**
   * Builds the outcome of a build process that could not be started.
   *
   * @param errorText launch error text
   * @return failed outcome carrying the error text and no diagnostics
   */
  public static BuildOutcome launchFailed(final String errorText) {
    return new BuildOutcome(RunStatus.FAILED, StringUtils.trimToEmpty(errorText), List.of());
  }

  public boolean passed() {
    return status == RunStatus.PASSED;
  }
}
