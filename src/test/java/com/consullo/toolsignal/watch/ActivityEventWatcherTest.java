package com.consullo.toolsignal.watch;

import com.consullo.toolsignal.core.memory.InMemoryTerminalGrid;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

public class ActivityEventWatcherTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private InMemoryTerminalGrid grid;
  private ActivityEventWatcher watcher;
  private List<ActivityEvent> events;

  @BeforeEach
  void setUp() {
    ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
    doReturn(mock(ScheduledFuture.class)).when(scheduler)
            .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

    grid = new InMemoryTerminalGrid(6);
    watcher = new ActivityEventWatcher(WatcherConfig.activity(), scheduler, Runnable::run,
            Clock.fixed(NOW, ZoneOffset.UTC));
    events = new ArrayList<>();
    watcher.setListener(events::add);
    watcher.attach(grid);
  }

  @Test
  @DisplayName("Should emit one event per recognized changed row, in row order")
  void pollNow_NewRows_EmitsEventsInOrder() {
    grid.setLines(0, List.of(
            "Reading file: src/App.java",
            "$ npm test",
            "Thinking...",
            "plain text",
            ""));

    watcher.pollNow();

    assertThat(events).containsExactly(
            ActivityEvent.fileRead("src/App.java", NOW),
            ActivityEvent.commandRun("npm test", NOW),
            ActivityEvent.agentStatus("Thinking...", NOW));
  }

  @Test
  @DisplayName("Should not report rows that did not change since the last poll")
  void pollNow_Unchanged_NoEvents() {
    grid.setLine(0, "Running: cargo test");
    watcher.pollNow();
    events.clear();

    watcher.pollNow();
    grid.setLine(1, "\u001B[32m✓\u001B[0m Tests passed");
    watcher.pollNow();

    assertThat(events).containsExactly(ActivityEvent.agentStatus("Tests passed", NOW));
  }

  @Test
  @DisplayName("Should start from a fresh row cache after re-attach")
  void attach_Again_RowsReportedAgain() {
    grid.setLine(0, "> git status");
    watcher.pollNow();

    watcher.detach();
    watcher.attach(grid);
    watcher.pollNow();

    assertThat(events).extracting(ActivityEvent::label).containsExactly("git status", "git status");
  }
}
