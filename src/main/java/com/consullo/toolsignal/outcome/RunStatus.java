package com.consullo.toolsignal.outcome;

/**
 * Final status of a build or test run.
 *
 * @since 1.0
 */
public enum RunStatus {
  PASSED,
  FAILED
}
