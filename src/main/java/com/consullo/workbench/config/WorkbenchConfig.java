package com.consullo.workbench.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Configuration values for the workbench state engine.
 *
 * @param dataDirectory directory holding the record database and recovery snapshots
 * @param snapshotId top-level identifier of the recovery snapshot
 * @param shellCommand command and arguments started inside each terminal session
 * @param outputChunkBytes maximum bytes coalesced into one terminal output action
 * @param maxInFlightOutput terminal output actions a session may have queued before its pump stops reading
 * @param terminalOutputChars size of the terminal output tail kept in state
 * @param maxChatMessages chat history cap per worktree
 * @param maxRecentProjects recent project list cap
 * @param completionCommand executable used by the Claude CLI completion backend
 * @param completionEventTimeout maximum silence between completion events before the stream fails
 * @since 1.0
 */
public record WorkbenchConfig(
    Path dataDirectory,
    String snapshotId,
    List<String> shellCommand,
    int outputChunkBytes,
    int maxInFlightOutput,
    int terminalOutputChars,
    int maxChatMessages,
    int maxRecentProjects,
    String completionCommand,
    Duration completionEventTimeout) {

  public static final String PROPERTY_PREFIX = "workbench.";

  public WorkbenchConfig {
    Validate.notNull(dataDirectory, "dataDirectory must not be null");
    Validate.notBlank(snapshotId, "snapshotId must not be blank");
    Validate.notEmpty(shellCommand, "shellCommand must not be empty");
    Validate.isTrue(outputChunkBytes > 0, "outputChunkBytes must be positive");
    Validate.isTrue(maxInFlightOutput > 0, "maxInFlightOutput must be positive");
    Validate.isTrue(terminalOutputChars > 0, "terminalOutputChars must be positive");
    Validate.isTrue(maxChatMessages > 0, "maxChatMessages must be positive");
    Validate.isTrue(maxRecentProjects > 0, "maxRecentProjects must be positive");
    Validate.notBlank(completionCommand, "completionCommand must not be blank");
    Validate.notNull(completionEventTimeout, "completionEventTimeout must not be null");
    shellCommand = List.copyOf(shellCommand);
  }

  /**
   * Default configuration rooted at the given data directory.
   *
   * @param dataDirectory data directory
   * @return defaults
   */
  public static WorkbenchConfig defaults(final Path dataDirectory) {
    return new WorkbenchConfig(
        dataDirectory,
        "default",
        List.of(defaultShell()),
        16 * 1024,
        8,
        32 * 1024,
        100,
        10,
        "claude",
        Duration.ofSeconds(30));
  }

  /**
   * Defaults overlaid with {@code workbench.*} system properties.
   *
   * <p>Recognised keys: {@code dataDir}, {@code snapshotId}, {@code shell}, {@code outputChunkBytes},
   * {@code maxInFlightOutput}, {@code terminalOutputChars}, {@code maxChatMessages}, {@code maxRecentProjects},
   * {@code completionCommand}, {@code completionTimeoutSeconds}.
   *
   * @return resolved configuration
   */
  public static WorkbenchConfig fromSystemProperties() {
    final String home = StringUtils.defaultIfBlank(System.getenv("HOME"), System.getProperty("user.home"));
    final Path dataDir = Path.of(property("dataDir", Path.of(home, ".consullo-workbench").toString()));
    final WorkbenchConfig defaults = defaults(dataDir);

    final String shell = System.getProperty(PROPERTY_PREFIX + "shell");
    return new WorkbenchConfig(
        dataDir,
        property("snapshotId", defaults.snapshotId()),
        StringUtils.isBlank(shell) ? defaults.shellCommand() : List.of(StringUtils.split(shell)),
        intProperty("outputChunkBytes", defaults.outputChunkBytes()),
        intProperty("maxInFlightOutput", defaults.maxInFlightOutput()),
        intProperty("terminalOutputChars", defaults.terminalOutputChars()),
        intProperty("maxChatMessages", defaults.maxChatMessages()),
        intProperty("maxRecentProjects", defaults.maxRecentProjects()),
        property("completionCommand", defaults.completionCommand()),
        Duration.ofSeconds(intProperty("completionTimeoutSeconds",
            (int) defaults.completionEventTimeout().toSeconds())));
  }

  public Path databaseFile() {
    return this.dataDirectory.resolve("workbench.db");
  }

  public Path snapshotDirectory() {
    return this.dataDirectory.resolve("snapshots");
  }

  public WorkbenchConfig withShellCommand(final List<String> command) {
    return new WorkbenchConfig(dataDirectory, snapshotId, command, outputChunkBytes, maxInFlightOutput,
        terminalOutputChars, maxChatMessages, maxRecentProjects, completionCommand, completionEventTimeout);
  }

  public WorkbenchConfig withMaxInFlightOutput(final int permits) {
    return new WorkbenchConfig(dataDirectory, snapshotId, shellCommand, outputChunkBytes, permits,
        terminalOutputChars, maxChatMessages, maxRecentProjects, completionCommand, completionEventTimeout);
  }

  private static String defaultShell() {
    final String shell = System.getenv("SHELL");
    if (StringUtils.isNotBlank(shell)) {
      return shell;
    }
    final String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    return os.contains("win") ? "powershell.exe" : "/bin/bash";
  }

  private static String property(final String key, final String fallback) {
    return StringUtils.defaultIfBlank(System.getProperty(PROPERTY_PREFIX + key), fallback);
  }

  private static int intProperty(final String key, final int fallback) {
    final String raw = System.getProperty(PROPERTY_PREFIX + key);
    if (StringUtils.isBlank(raw)) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("System property " + PROPERTY_PREFIX + key + " is not an integer: " + raw, e);
    }
  }
}
