package com.consullo.toolsignal.watch;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AgentModeTest {

  @Test
  @DisplayName("Should cycle Interactive, Plan, Autopilot and wrap")
  void next_CyclesInOrder() {
    assertThat(AgentMode.INTERACTIVE.next()).isEqualTo(AgentMode.PLAN);
    assertThat(AgentMode.PLAN.next()).isEqualTo(AgentMode.AUTOPILOT);
    assertThat(AgentMode.AUTOPILOT.next()).isEqualTo(AgentMode.INTERACTIVE);
  }

  @Test
  @DisplayName("Should map words and aliases to modes")
  void fromToken_WordsAndAliases() {
    assertThat(AgentMode.fromToken("ASK")).contains(AgentMode.INTERACTIVE);
    assertThat(AgentMode.fromToken("agent")).contains(AgentMode.AUTOPILOT);
    assertThat(AgentMode.fromToken("plan")).contains(AgentMode.PLAN);
    assertThat(AgentMode.fromToken("chat")).isEmpty();
  }

  @Test
  @DisplayName("Should build the slash command that activates a mode")
  void activateCommand_IncludesNewline() {
    assertThat(AgentMode.PLAN.activateCommand()).isEqualTo("/agent plan\n");
    assertThat(AgentMode.AUTOPILOT.displayName()).isEqualTo("Autopilot");
  }

  @Test
  @DisplayName("Should reject an empty activity detail")
  void activityEvent_EmptyDetail_Throws() {
    assertThatThrownBy(() -> ActivityEvent.commandRun("", Instant.EPOCH))
            .isInstanceOf(IllegalArgumentException.class);
  }
}
