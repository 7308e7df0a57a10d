package com.consullo.toolsignal.parse.test;

import com.consullo.toolsignal.parse.LineSupport;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses raw test output from several runners into pass/fail counts, failed names and per-case detail.
 *
 * <p>Formats are tried in a fixed priority order and the first that yields a concrete count wins:
 * <ol>
 * <li>XCTest</li>
 * <li>swift-testing</li>
 * <li>Cargo/rustc</li>
 * <li>pytest</li>
 * <li>Go</li>
 * <li>Jest/Mocha</li>
 * </ol>
 * When none matches, a generic scan collects failed names only.
 *
 * <p>Stateless and thread-safe; identical input always yields an equal result.
 *
 * @since 1.0
 */
public final class TestResultParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TestResultParser.class);

  static final List<TestOutputFormat> FORMATS = List.of(
          new XcTestFormat(),
          new SwiftTestingFormat(),
          new CargoTestFormat(),
          new PytestFormat(),
          new GoTestFormat(),
          new JestMochaFormat());

  private TestResultParser() {
  }

  /**
   * Parses a test output blob.
   *
   * @param output combined stdout and stderr, may be null
   * @return parsed result; {@link TestRunResult#empty()} for a null or empty blob
   */
  public static TestRunResult parse(final String output) {
    List<String> lines = LineSupport.lines(output);
    if (lines.isEmpty()) {
      return TestRunResult.empty();
    }

    for (TestOutputFormat format : FORMATS) {
      Optional<TestRunResult> result = format.parse(lines);
      if (result.isPresent()) {
        LOGGER.debug("recognized {} output: {} passed, {} failed",
                format.name(), result.get().totalPassed(), result.get().failedNames().size());
        return result.get();
      }
    }

    TestRunResult fallback = FallbackFailureScanner.scan(lines);
    LOGGER.debug("no known format; fallback found {} failed names", fallback.failedNames().size());
    return fallback;
  }
}
