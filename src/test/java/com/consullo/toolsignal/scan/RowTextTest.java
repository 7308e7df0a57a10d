package com.consullo.toolsignal.scan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RowTextTest {

  @Test
  @DisplayName("Should strip CSI color sequences")
  void stripAnsi_ColorCodes_Removed() {
    assertThat(RowText.stripAnsi("\u001B[1;32m✓\u001B[0m done")).isEqualTo("✓ done");
  }

  @Test
  @DisplayName("Should trim spaces, tabs and NUL cells")
  void trim_BlankCells_Removed() {
    assertThat(RowText.trim("\0\0 > ls\t ")).isEqualTo("> ls");
    assertThat(RowText.trim(null)).isEmpty();
  }

  @Test
  @DisplayName("Should strip then trim")
  void clean_EscapesAndPadding_Removed() {
    assertThat(RowText.clean("  \u001B[2mReading file: a.txt\u001B[0m   ")).isEqualTo("Reading file: a.txt");
  }
}
