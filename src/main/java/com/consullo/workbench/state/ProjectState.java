package com.consullo.workbench.state;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.Validate;

/**
 * An open project (git repository) and its worktrees.
 *
 * @param key project key derived once from {@code path} when the project was opened
 * @param path main worktree directory
 * @param name display name
 * @param worktrees worktrees, main worktree first
 * @param activeWorktreeIndex index of the active worktree
 * @param envConfig environment file sync configuration
 * @since 1.0
 */
public record ProjectState(
    String key,
    String path,
    String name,
    List<WorktreeState> worktrees,
    int activeWorktreeIndex,
    EnvConfig envConfig) {

  public ProjectState {
    Validate.notNull(key, "key must not be null");
    Validate.notBlank(path, "path must not be blank");
    Validate.notEmpty(worktrees, "a project has at least its main worktree");
    worktrees = List.copyOf(worktrees);
    Validate.isTrue(activeWorktreeIndex >= 0 && activeWorktreeIndex < worktrees.size(),
        "activeWorktreeIndex out of range: %s", activeWorktreeIndex);
    envConfig = envConfig == null ? EnvConfig.withSource(path) : envConfig;
    name = name == null ? displayName(path) : name;
  }

  /**
   * Creates a freshly opened project with its main worktree.
   *
   * @param path project path
   * @return project
   */
  public static ProjectState open(final String path) {
    return new ProjectState(ProjectKeys.of(path).value(), path, displayName(path),
        List.of(WorktreeState.create(path, "main", true)), 0, EnvConfig.withSource(path));
  }

  public static String displayName(final String path) {
    final Path fileName = Path.of(path).getFileName();
    return fileName == null ? "project" : fileName.toString();
  }

  public ProjectKey projectKey() {
    return new ProjectKey(key);
  }

  public WorktreeState activeWorktree() {
    return worktrees.get(activeWorktreeIndex);
  }

  public WorktreeState worktree(final String worktreeId) {
    for (final WorktreeState w : worktrees) {
      if (w.id().equals(worktreeId)) {
        return w;
      }
    }
    return null;
  }

  public ProjectState withWorktrees(final List<WorktreeState> next, final int activeIndex) {
    return new ProjectState(key, path, name, next, activeIndex, envConfig);
  }

  public ProjectState withEnvConfig(final EnvConfig next) {
    return new ProjectState(key, path, name, worktrees, activeWorktreeIndex, next);
  }

  /**
   * Finds a worktree by directory.
   *
   * @param worktreePath normalized worktree path
   * @return the worktree, or {@code null}
   */
  public WorktreeState worktreeAt(final String worktreePath) {
    for (final WorktreeState w : worktrees) {
      if (w.path().equals(worktreePath)) {
        return w;
      }
    }
    return null;
  }

  public ProjectState mapWorktree(final String worktreeId, final UnaryOperator<WorktreeState> update) {
    final List<WorktreeState> next = new ArrayList<>(worktrees.size());
    boolean changed = false;
    for (final WorktreeState w : worktrees) {
      final WorktreeState updated = w.id().equals(worktreeId) ? update.apply(w) : w;
      changed |= updated != w;
      next.add(updated);
    }
    return changed ? withWorktrees(next, activeWorktreeIndex) : this;
  }
}
