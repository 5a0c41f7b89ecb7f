package com.consullo.workbench.store;

import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ChatMessage;
import com.consullo.workbench.state.ChatState;
import com.consullo.workbench.state.ExplorerState;
import com.consullo.workbench.state.ProjectState;
import com.consullo.workbench.state.TerminalState;
import com.consullo.workbench.state.TerminalStatus;
import com.consullo.workbench.state.WorktreeState;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Adjusts a state loaded from the recovery file to a fresh process: no terminal session and no background work
 * survives a restart.
 */
final class StateRecovery {

  static final String INTERRUPTED = "interrupted";

  private StateRecovery() {
  }

  static AppState sanitize(final AppState state) {
    final List<ProjectState> projects = new ArrayList<>(state.projects().size());
    for (final ProjectState p : state.projects()) {
      final List<WorktreeState> worktrees = new ArrayList<>(p.worktrees().size());
      for (final WorktreeState w : p.worktrees()) {
        worktrees.add(w.withTerminal(terminal(w.terminal())).withExplorer(explorer(w.explorer()))
            .withChat(chat(w.chat())));
      }
      projects.add(p.withWorktrees(worktrees, p.activeWorktreeIndex()));
    }
    return state.withProjects(projects, state.activeProjectIndex());
  }

  private static TerminalState terminal(final TerminalState t) {
    if (t.status() == TerminalStatus.IDLE && !t.hasSession()) {
      return t;
    }
    return new TerminalState(null, t.cols(), t.rows(), TerminalStatus.IDLE, null, t.exitCode(), t.output());
  }

  private static ExplorerState explorer(final ExplorerState e) {
    return e.loadingPaths().isEmpty() ? e : e.withLoadingPaths(Set.of());
  }

  private static ChatState chat(final ChatState c) {
    ChatState next = c;
    for (final ChatMessage m : c.messages()) {
      if (m.isStreaming()) {
        next = next.updateMessage(m.id(), msg -> msg.fail(INTERRUPTED));
      }
    }
    return next;
  }
}
