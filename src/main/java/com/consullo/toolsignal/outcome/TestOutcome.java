package com.consullo.toolsignal.outcome;

import com.consullo.toolsignal.parse.test.TestResultParser;
import com.consullo.toolsignal.parse.test.TestRunResult;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Result of one test run.
 *
 * <p>A passed run carries the passed count; a failed run carries the failed names and the trimmed output, suitable
 * for handing back to an agent as a fix request. Both carry the full parse.
 *
 * @param status run status
 * @param totalPassed passed count
 * @param failedNames failed test names; may be empty when the output was not recognized
 * @param output trimmed combined output of a failed run; empty for a passed run
 * @param result full parse of the output
 * @since 1.0
 */
public record TestOutcome(
    RunStatus status,
    int totalPassed,
    List<String> failedNames,
    String output,
    TestRunResult result) {

  public TestOutcome {
    Validate.notNull(status, "status must not be null");
    Validate.notNull(result, "result must not be null");
    failedNames = failedNames == null ? List.of() : List.copyOf(failedNames);
    output = StringUtils.defaultString(output);
  }

  /**
   * Builds the outcome of a finished test process.
   *
   * @param combinedOutput stdout followed by stderr
   * @param exitCode process exit code
   * @return outcome
   */
  public static TestOutcome fromRun(final String combinedOutput, final int exitCode) {
    String trimmed = StringUtils.trimToEmpty(combinedOutput);
    TestRunResult result = TestResultParser.parse(trimmed);
    if (exitCode == 0) {
      return new TestOutcome(RunStatus.PASSED, result.totalPassed(), List.of(), "", result);
    }
    return new TestOutcome(RunStatus.FAILED, result.totalPassed(), result.failedNames(), trimmed, result);
  }

  /**
   * Builds the outcome of a test process that could not be started.
   *
   * @param errorText launch error text
   * @return failed outcome with no names
   */
  public static TestOutcome launchFailed(final String errorText) {
    return new TestOutcome(RunStatus.FAILED, 0, List.of(), StringUtils.trimToEmpty(errorText),
            TestRunResult.empty());
  }

  public boolean passed() {
    return status == RunStatus.PASSED;
  }
}
