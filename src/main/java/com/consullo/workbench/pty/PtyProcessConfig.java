package com.consullo.workbench.pty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Configuration for spawning a PTY-attached process.
 *
 * @param command command and arguments (e.g., ["/bin/bash", "-l"])
 * @param workingDirectory working directory for the spawned process
 * @param environment variables added to the inherited environment
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows) {

  public PtyProcessConfig {
    Validate.notEmpty(command, "command must not be empty");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.isTrue(initialColumns > 0, "initialColumns must be positive");
    Validate.isTrue(initialRows > 0, "initialRows must be positive");
    command = List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }
}
