package com.consullo.toolsignal.watch;

/**
 * Braille spinner glyphs emitted by common CLI spinner libraries while a tool is still working.
 */
public final class SpinnerGlyphs {

  private static final String GLYPHS = "⠋⠙⠹⠸⠼⠴⠦⠧⠇⠏";

  private SpinnerGlyphs() {
  }

  public static boolean isSpinnerGlyph(char c) {
    return GLYPHS.indexOf(c) >= 0;
  }

  /**
   * Returns true when any character of {@code text} is a spinner glyph.
   *
   * @param text line text, may be null
   * @return true if a spinner is present
   */
  public static boolean containsSpinner(String text) {
    if (text == null) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (isSpinnerGlyph(text.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  /**
   * The glyphs as a regex character-class body.
   *
   * @return glyph characters
   */
  static String asCharacterClass() {
    return GLYPHS;
  }
}
