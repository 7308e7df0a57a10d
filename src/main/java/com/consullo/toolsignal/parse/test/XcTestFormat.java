package com.consullo.toolsignal.parse.test;

import com.consullo.toolsignal.parse.LineSupport;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * XCTest: {@code Executed N tests, with F failures} summaries plus {@code Test Case '...' passed|failed} lines.
 * Nested suites repeat their totals, so the last summary wins.
 */
final class XcTestFormat implements TestOutputFormat {

  private static final Pattern SUMMARY = Pattern.compile("(?i)executed (\\d+) tests?, with (\\d+) failures?");

  private static final Pattern CASE = Pattern.compile(
          "Test Case '(.+?)' (passed|failed)(?: \\((\\d+(?:\\.\\d+)?) seconds\\))?");

  // <file>:<line>: error: <case name> : <message>
  private static final Pattern ERROR = Pattern.compile("^(.+?):(\\d+): error: (.+?) : (.+)$");

  @Override
  public String name() {
    return "xctest";
  }

  @Override
  public Optional<TestRunResult> parse(final List<String> lines) {
    Integer totalPassed = null;
    List<TestCase> cases = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    Map<String, String> messages = new HashMap<>();

    for (String line : lines) {
      Matcher s = SUMMARY.matcher(line);
      if (s.find()) {
        Integer total = LineSupport.parseIntOrNull(s.group(1));
        Integer failures = LineSupport.parseIntOrNull(s.group(2));
        if (total != null && failures != null) {
          totalPassed = Math.max(total - failures, 0);
        }
      }

      Matcher c = CASE.matcher(line);
      if (c.find()) {
        String name = c.group(1).trim();
        if (name.isEmpty()) {
          continue;
        }
        Double duration = LineSupport.parseDecimalOrNull(c.group(3));
        if ("passed".equals(c.group(2))) {
          cases.add(TestCase.passed(name, duration));
        } else {
          cases.add(TestCase.failed(name, duration, null));
          failed.add(name);
        }
        continue;
      }

      Matcher e = ERROR.matcher(line.trim());
      if (e.find()) {
        messages.merge(e.group(3).trim(), e.group(4).trim(), (a, b) -> a + "\n" + b);
      }
    }

    if (totalPassed == null) {
      return Optional.empty();
    }
    List<TestCase> withMessages = new ArrayList<>(cases.size());
    for (TestCase tc : cases) {
      String msg = tc.passed() ? null : messages.get(tc.name());
      withMessages.add(msg == null ? tc : tc.withFailureMessage(msg));
    }
    return Optional.of(new TestRunResult(totalPassed, failed, withMessages));
  }
}
