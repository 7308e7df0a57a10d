package com.consullo.toolsignal.watch;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one clean (escape-free, trimmed) terminal line as an agent action.
 *
 * <p>Patterns are data: each entry pairs a regex whose first group captures the detail with the event kind it
 * produces. Tables are evaluated in priority order (file reads, then commands, then status lines) and the first hit
 * wins. Adding a tool's convention means adding a row.
 *
 * @since 1.0
 */
public final class AgentLineClassifier {

  private static final int MAX_STATUS_LENGTH = 80;

  private static final List<String> STATUS_KEYWORDS = List.of(
          "thinking", "working", "planning", "analyzing", "searching", "generating", "processing");

  private record LinePattern(Pattern pattern, ActivityEvent.Kind kind) {

    static LinePattern of(String regex, ActivityEvent.Kind kind) {
      return new LinePattern(Pattern.compile(regex), kind);
    }
  }

  private static final List<LinePattern> DETAIL_PATTERNS = List.of(
          LinePattern.of("(?i)reading file[:\\s]+(.+)", ActivityEvent.Kind.FILE_READ),
          LinePattern.of("(?i)opening file[:\\s]+(.+)", ActivityEvent.Kind.FILE_READ),
          LinePattern.of("(?i)\\bread[:\\s]+(\\S.+\\.\\w{1,10})\\b", ActivityEvent.Kind.FILE_READ),
          LinePattern.of("(?i)running[:\\s]+(.+)", ActivityEvent.Kind.COMMAND_RUN),
          LinePattern.of("(?i)executing[:\\s]+(.+)", ActivityEvent.Kind.COMMAND_RUN),
          LinePattern.of("^>\\s+(.+)", ActivityEvent.Kind.COMMAND_RUN),
          LinePattern.of("^\\$\\s+(.+)", ActivityEvent.Kind.COMMAND_RUN));

  private static final List<LinePattern> STATUS_PREFIX_PATTERNS = List.of(
          LinePattern.of("^[✓✔✗✘]\\s+(.+)", ActivityEvent.Kind.AGENT_STATUS),
          LinePattern.of("^[" + SpinnerGlyphs.asCharacterClass() + "]\\s+(.+)", ActivityEvent.Kind.AGENT_STATUS));

  private AgentLineClassifier() {
  }

  /**
   * Classifies a line.
   *
   * @param line clean line text
   * @param timestamp detection time
   * @return event, or empty when the line matches no known action
   */
  public static Optional<ActivityEvent> classify(final String line, final Instant timestamp) {
    if (line == null || line.isEmpty()) {
      return Optional.empty();
    }

    for (LinePattern p : DETAIL_PATTERNS) {
      String detail = firstCapture(p.pattern(), line);
      if (detail != null) {
        return Optional.of(create(p.kind(), detail, timestamp));
      }
    }

    if (line.codePointCount(0, line.length()) < MAX_STATUS_LENGTH) {
      String lower = line.toLowerCase(Locale.ROOT);
      for (String keyword : STATUS_KEYWORDS) {
        if (lower.contains(keyword)) {
          return Optional.of(ActivityEvent.agentStatus(line, timestamp));
        }
      }
    }

    for (LinePattern p : STATUS_PREFIX_PATTERNS) {
      String detail = firstCapture(p.pattern(), line);
      if (detail != null) {
        return Optional.of(create(p.kind(), detail, timestamp));
      }
    }
    return Optional.empty();
  }

  private static ActivityEvent create(final ActivityEvent.Kind kind, final String detail, final Instant ts) {
    switch (kind) {
      case FILE_READ:
        return ActivityEvent.fileRead(detail, ts);
      case COMMAND_RUN:
        return ActivityEvent.commandRun(detail, ts);
      default:
        return ActivityEvent.agentStatus(detail, ts);
    }
  }

  private static String firstCapture(final Pattern pattern, final String text) {
    Matcher m = pattern.matcher(text);
    if (!m.find() || m.group(1) == null) {
      return null;
    }
    String captured = m.group(1).trim();
    return captured.isEmpty() ? null : captured;
  }
}
