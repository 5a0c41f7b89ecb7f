package com.consullo.workbench.state;

import java.nio.file.Path;
import org.apache.commons.lang3.Validate;

/**
 * A git worktree of a project with its own explorer, terminal and chat.
 *
 * @param id stable id, {@code wt-} followed by the key of the worktree path
 * @param path worktree directory
 * @param branch checked out branch
 * @param main whether this is the project's main worktree
 * @param explorer explorer state
 * @param terminal terminal state
 * @param chat chat state
 * @since 1.0
 */
public record WorktreeState(
    String id,
    String path,
    String branch,
    boolean main,
    ExplorerState explorer,
    TerminalState terminal,
    ChatState chat) {

  public WorktreeState {
    Validate.notBlank(id, "id must not be blank");
    Validate.notBlank(path, "path must not be blank");
    Validate.notBlank(branch, "branch must not be blank");
    explorer = explorer == null ? ExplorerState.EMPTY : explorer;
    terminal = terminal == null ? TerminalState.INITIAL : terminal;
    chat = chat == null ? ChatState.EMPTY : chat;
  }

  public static WorktreeState create(final String path, final String branch, final boolean main) {
    return new WorktreeState(idFor(path), path, branch, main, ExplorerState.EMPTY, TerminalState.INITIAL,
        ChatState.EMPTY);
  }

  public static String idFor(final String path) {
    return "wt-" + ProjectKeys.of(path).value();
  }

  public Path directory() {
    return Path.of(path);
  }

  public WorktreeState withExplorer(final ExplorerState next) {
    return next == explorer ? this : new WorktreeState(id, path, branch, main, next, terminal, chat);
  }

  public WorktreeState withTerminal(final TerminalState next) {
    return next == terminal ? this : new WorktreeState(id, path, branch, main, explorer, next, chat);
  }

  public WorktreeState withChat(final ChatState next) {
    return next == chat ? this : new WorktreeState(id, path, branch, main, explorer, terminal, next);
  }
}
