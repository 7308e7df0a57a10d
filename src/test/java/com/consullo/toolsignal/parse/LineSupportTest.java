package com.consullo.toolsignal.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LineSupportTest {

  @Test
  @DisplayName("Should split on LF, CRLF and CR alike")
  void lines_MixedTerminators_SplitsEveryLine() {
    assertThat(LineSupport.lines("a\nb\r\nc\rd")).containsExactly("a", "b", "c", "d");
  }

  @Test
  @DisplayName("Should return no lines for null or empty input")
  void lines_NullOrEmpty_ReturnsEmpty() {
    assertThat(LineSupport.lines(null)).isEmpty();
    assertThat(LineSupport.lines("")).isEmpty();
  }

  @Test
  @DisplayName("Should return null instead of throwing for unparseable numbers")
  void parseOrNull_BadInput_ReturnsNull() {
    assertThat(LineSupport.parseIntOrNull("42")).isEqualTo(42);
    assertThat(LineSupport.parseIntOrNull("99999999999")).isNull();
    assertThat(LineSupport.parseIntOrNull(null)).isNull();
    assertThat(LineSupport.parseDecimalOrNull("0.02")).isEqualTo(0.02);
    assertThat(LineSupport.parseDecimalOrNull("x")).isNull();
  }
}
