package com.consullo.toolsignal.outcome;

import com.consullo.toolsignal.parse.test.TestCase;
import java.time.Instant;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * One completed test run as retained for display: when it finished, its cases and its raw output.
 *
 * @param timestamp completion time
 * @param cases per-case results
 * @param rawOutput raw combined output
 * @param succeeded true when the run exited successfully
 * @since 1.0
 */
public record TestRunRecord(
    Instant timestamp,
    List<TestCase> cases,
    String rawOutput,
    boolean succeeded) {

  public TestRunRecord {
    Validate.notNull(timestamp, "timestamp must not be null");
    cases = cases == null ? List.of() : List.copyOf(cases);
    rawOutput = StringUtils.defaultString(rawOutput);
  }

  /**
   * Captures a test outcome.
   *
   * @param outcome finished run
   * @param rawOutput raw combined output
   * @param timestamp completion time
   * @return record
   */
  public static TestRunRecord of(final TestOutcome outcome, final String rawOutput, final Instant timestamp) {
    Validate.notNull(outcome, "outcome must not be null");
    return new TestRunRecord(timestamp, outcome.result().cases(), rawOutput, outcome.passed());
  }

  public int passedCount() {
    return (int) cases.stream().filter(TestCase::passed).count();
  }

  public int failedCount() {
    return (int) cases.stream().filter(c -> !c.passed()).count();
  }
}
