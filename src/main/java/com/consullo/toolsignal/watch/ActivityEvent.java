package com.consullo.toolsignal.watch;

import java.time.Instant;
import java.util.Objects;

/**
 * A discrete agent action recognized on one terminal line.
 */
public final class ActivityEvent {

  public enum Kind {
    FILE_READ,
    COMMAND_RUN,
    AGENT_STATUS
  }

  private final Instant timestamp;
  private final Kind kind;
  private final String detail;

  private ActivityEvent(Instant timestamp, Kind kind, String detail) {
    this.timestamp = timestamp;
    this.kind = kind;
    this.detail = detail;
  }

  public static ActivityEvent fileRead(String path, Instant ts) {
    return create(Kind.FILE_READ, path, ts);
  }

  public static ActivityEvent commandRun(String command, Instant ts) {
    return create(Kind.COMMAND_RUN, command, ts);
  }

  public static ActivityEvent agentStatus(String status, Instant ts) {
    return create(Kind.AGENT_STATUS, status, ts);
  }

  private static ActivityEvent create(Kind kind, String detail, Instant ts) {
    if (detail == null || detail.isEmpty() || ts == null) {
      throw new IllegalArgumentException("detail must not be empty and ts must not be null.");
    }
    return new ActivityEvent(ts, kind, detail);
  }

  public Instant timestamp() {
    return timestamp;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * The file path, command, or status text, depending on {@link #kind()}.
   *
   * @return label text
   */
  public String label() {
    return detail;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ActivityEvent)) {
      return false;
    }
    ActivityEvent other = (ActivityEvent) o;
    return kind == other.kind && detail.equals(other.detail) && timestamp.equals(other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, detail, timestamp);
  }

  @Override
  public String toString() {
    return "ActivityEvent{" + kind + " '" + detail + "' at " + timestamp + "}";
  }
}
