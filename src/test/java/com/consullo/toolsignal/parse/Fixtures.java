package com.consullo.toolsignal.parse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Loads captured tool output from test resources.
 */
public final class Fixtures {

  private Fixtures() {
  }

  public static String load(final String path) throws IOException {
    InputStream is = Fixtures.class.getClassLoader().getResourceAsStream(path);
    if (is == null) {
      throw new IllegalStateException("Missing resource: " + path);
    }
    try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      StringBuilder sb = new StringBuilder();
      String line;
      while ((line = br.readLine()) != null) {
        sb.append(line);
        sb.append("\n");
      }
      return sb.toString();
    }
  }
}
