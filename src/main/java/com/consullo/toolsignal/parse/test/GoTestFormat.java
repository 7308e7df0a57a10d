package com.consullo.toolsignal.parse.test;

import com.consullo.toolsignal.parse.LineSupport;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go: {@code --- PASS: Name (Ns)} and {@code --- FAIL: Name (Ns)} lines. Indented {@code file.go:line: message}
 * lines that follow a failure become its message.
 */
final class GoTestFormat implements TestOutputFormat {

  private static final Pattern RESULT = Pattern.compile("^--- (PASS|FAIL): (\\S+)(?: \\((\\d+(?:\\.\\d+)?)s\\))?");

  private static final Pattern LOCATED_MESSAGE = Pattern.compile("^\\S+\\.go:\\d+: .*$");

  @Override
  public String name() {
    return "go";
  }

  @Override
  public Optional<TestRunResult> parse(final List<String> lines) {
    int passCount = 0;
    List<TestCase> cases = new ArrayList<>();
    List<String> failed = new ArrayList<>();

    int collectingFor = -1;
    List<String> messageLines = new ArrayList<>();

    for (String line : lines) {
      String trimmed = line.trim();

      if (collectingFor >= 0) {
        boolean indented = !line.isEmpty() && Character.isWhitespace(line.charAt(0));
        if (indented && LOCATED_MESSAGE.matcher(trimmed).matches()) {
          messageLines.add(trimmed);
          continue;
        }
        attachMessage(cases, collectingFor, messageLines);
        collectingFor = -1;
      }

      Matcher m = RESULT.matcher(trimmed);
      if (!m.find()) {
        continue;
      }
      String name = m.group(2);
      Double duration = LineSupport.parseDecimalOrNull(m.group(3));
      if ("PASS".equals(m.group(1))) {
        passCount++;
        cases.add(TestCase.passed(name, duration));
      } else {
        failed.add(name);
        cases.add(TestCase.failed(name, duration, null));
        collectingFor = cases.size() - 1;
        messageLines.clear();
      }
    }
    if (collectingFor >= 0) {
      attachMessage(cases, collectingFor, messageLines);
    }

    if (cases.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new TestRunResult(passCount, failed, cases));
  }

  private static void attachMessage(final List<TestCase> cases, final int index, final List<String> messageLines) {
    if (!messageLines.isEmpty()) {
      cases.set(index, cases.get(index).withFailureMessage(String.join("\n", messageLines)));
    }
  }
}
