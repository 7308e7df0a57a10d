package com.consullo.toolsignal.outcome;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;

/**
 * Caller-owned single slot holding the most recent run. Each {@link #record} replaces the previous value wholesale.
 *
 * @param <T> run type, e.g. {@link TestRunRecord} or {@link BuildOutcome}
 * @since 1.0
 */
public final class LatestRunStore<T> {

  private final AtomicReference<T> latest = new AtomicReference<>();

  public void record(final T run) {
    Validate.notNull(run, "run must not be null");
    latest.set(run);
  }

  public Optional<T> latest() {
    return Optional.ofNullable(latest.get());
  }

  public void clear() {
    latest.set(null);
  }
}
