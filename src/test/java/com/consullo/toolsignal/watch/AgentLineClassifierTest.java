package com.consullo.toolsignal.watch;

import java.time.Instant;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AgentLineClassifierTest {

  private static final Instant NOW = Instant.EPOCH;

  @Test
  @DisplayName("Should classify file reads")
  void classify_FileRead() {
    assertThat(kindAndLabel("Reading file: src/main.rs")).isEqualTo("FILE_READ src/main.rs");
    assertThat(kindAndLabel("Opening file /etc/hosts")).isEqualTo("FILE_READ /etc/hosts");
    assertThat(kindAndLabel("Read: docs/README.md")).isEqualTo("FILE_READ docs/README.md");
  }

  @Test
  @DisplayName("Should classify commands")
  void classify_Command() {
    assertThat(kindAndLabel("Running: cargo test")).isEqualTo("COMMAND_RUN cargo test");
    assertThat(kindAndLabel("Executing make all")).isEqualTo("COMMAND_RUN make all");
    assertThat(kindAndLabel("> ls -la")).isEqualTo("COMMAND_RUN ls -la");
    assertThat(kindAndLabel("$ git diff")).isEqualTo("COMMAND_RUN git diff");
  }

  @Test
  @DisplayName("Should classify short keyword lines as whole-line status")
  void classify_StatusKeyword() {
    assertThat(kindAndLabel("Analyzing dependencies")).isEqualTo("AGENT_STATUS Analyzing dependencies");
    assertThat(kindAndLabel("⠋ Generating response")).isEqualTo("AGENT_STATUS ⠋ Generating response");
  }

  @Test
  @DisplayName("Should classify check mark and spinner prefixes")
  void classify_StatusPrefix() {
    assertThat(kindAndLabel("✔ Build succeeded")).isEqualTo("AGENT_STATUS Build succeeded");
    assertThat(kindAndLabel("⠙ Compiling sources")).isEqualTo("AGENT_STATUS Compiling sources");
  }

  @Test
  @DisplayName("Should ignore long keyword lines and unrelated text")
  void classify_NoMatch() {
    String longLine = "thinking " + StringUtils.repeat("x", 80);

    assertThat(AgentLineClassifier.classify(longLine, NOW)).isEmpty();
    assertThat(AgentLineClassifier.classify("I already read the docs", NOW)).isEmpty();
    assertThat(AgentLineClassifier.classify("", NOW)).isEmpty();
  }

  private static String kindAndLabel(final String line) {
    Optional<ActivityEvent> event = AgentLineClassifier.classify(line, NOW);
    assertThat(event).as("classification of '%s'", line).isPresent();
    return event.get().kind() + " " + event.get().label();
  }
}
