package com.consullo.workbench.state;

import java.util.List;

/**
 * Project-scoped environment file sync configuration.
 *
 * @param trackedPatterns file patterns copied between worktrees
 * @param autoCopy copy tracked files automatically when a worktree is added
 * @param sourceWorktree worktree path the files are copied from
 */
public record EnvConfig(List<String> trackedPatterns, boolean autoCopy, String sourceWorktree) {

  public static final List<String> DEFAULT_PATTERNS = List.of(".env", ".envrc", ".env.local");

  public EnvConfig {
    trackedPatterns = trackedPatterns == null ? DEFAULT_PATTERNS : List.copyOf(trackedPatterns);
  }

  public static EnvConfig withSource(final String sourceWorktree) {
    return new EnvConfig(DEFAULT_PATTERNS, true, sourceWorktree);
  }

  public EnvConfig withTrackedPatterns(final List<String> patterns) {
    return new EnvConfig(patterns, autoCopy, sourceWorktree);
  }

  public EnvConfig withAutoCopy(final boolean enabled) {
    return new EnvConfig(trackedPatterns, enabled, sourceWorktree);
  }

  public EnvConfig withSourceWorktree(final String path) {
    return new EnvConfig(trackedPatterns, autoCopy, path);
  }
}
