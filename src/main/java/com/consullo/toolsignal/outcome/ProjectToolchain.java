package com.consullo.toolsignal.outcome;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build and test commands for a project directory, detected from marker files. Commands are argument lists meant
 * for {@code /usr/bin/env}; this class never runs them.
 *
 * @param buildCommand build command, or empty when no build system was recognized
 * @param testCommand test command, or empty when no test system was recognized
 * @since 1.0
 */
public record ProjectToolchain(
    List<String> buildCommand,
    List<String> testCommand) {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectToolchain.class);

  private static final List<String> MAKEFILES = List.of("Makefile", "makefile", "GNUmakefile");

  private static final List<String> PYTHON_MARKERS = List.of("pytest.ini", "pyproject.toml", "setup.py");

  public ProjectToolchain {
    buildCommand = buildCommand == null ? List.of() : List.copyOf(buildCommand);
    testCommand = testCommand == null ? List.of() : List.copyOf(testCommand);
  }

  /**
   * Inspects {@code root} for marker files.
   *
   * @param root project root directory
   * @return detected commands; both empty for an unrecognized directory
   */
  public static ProjectToolchain detect(final Path root) {
    Validate.notNull(root, "root must not be null");
    ProjectToolchain toolchain = new ProjectToolchain(detectBuild(root), detectTest(root));
    LOGGER.debug("{}: build={} test={}", root, toolchain.buildCommand(), toolchain.testCommand());
    return toolchain;
  }

  public boolean canBuild() {
    return !buildCommand.isEmpty();
  }

  public boolean canTest() {
    return !testCommand.isEmpty();
  }

  private static List<String> detectBuild(final Path root) {
    if (exists(root, "Package.swift")) {
      return List.of("swift", "build");
    }
    if (exists(root, "package.json")) {
      return List.of("npm", "run", "build");
    }
    if (exists(root, "Cargo.toml")) {
      return List.of("cargo", "build");
    }
    if (anyExists(root, MAKEFILES)) {
      return List.of("make");
    }
    return List.of();
  }

  private static List<String> detectTest(final Path root) {
    if (exists(root, "Package.swift")) {
      return List.of("swift", "test");
    }
    if (exists(root, "package.json")) {
      // --passWithNoTests keeps a project without tests from failing.
      return List.of("npm", "test", "--", "--passWithNoTests");
    }
    if (exists(root, "Cargo.toml")) {
      return List.of("cargo", "test");
    }
    if (exists(root, "go.mod")) {
      return List.of("go", "test", "./...");
    }
    if (anyExists(root, PYTHON_MARKERS)) {
      return List.of("python", "-m", "pytest", "--tb=short", "-q");
    }
    if (anyExists(root, MAKEFILES)) {
      return List.of("make", "test");
    }
    return List.of();
  }

  private static boolean anyExists(final Path root, final List<String> names) {
    return names.stream().anyMatch(n -> exists(root, n));
  }

  private static boolean exists(final Path root, final String name) {
    return Files.exists(root.resolve(name));
  }
}
