package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ProjectState;
import com.consullo.workbench.state.TerminalState;
import com.consullo.workbench.state.TerminalStatus;
import com.consullo.workbench.state.WorktreeState;
import java.util.ArrayList;
import java.util.List;

/**
 * Terminal transitions. The state only ever holds a session id; the registry acts on the emitted effects.
 */
final class TerminalReducer {

  static final String SCOPE = "terminal";

  private final int outputChars;

  TerminalReducer(final int outputChars) {
    this.outputChars = outputChars;
  }

  Transition spawn(final AppState state, final Action.SpawnTerminal action) {
    final WorktreeState wt = state.worktree(action.worktreeId());
    if (wt == null || wt.terminal().hasSession() || wt.terminal().status() == TerminalStatus.SPAWNING) {
      return Transition.unchanged(state);
    }
    final AppState next = state.mapWorktree(wt.id(),
        w -> w.withTerminal(w.terminal().spawning(action.cols(), action.rows())));
    return Transition.of(next, new Effect.SpawnSession(wt.id(), wt.path(), action.cols(), action.rows()));
  }

  Transition spawned(final AppState state, final Action.TerminalSpawned action) {
    final WorktreeState wt = state.worktree(action.worktreeId());
    if (wt == null || wt.terminal().status() != TerminalStatus.SPAWNING) {
      // nobody is waiting for this session any more
      return Transition.of(state, new Effect.KillSession(action.sessionId()));
    }
    final AppState next = state.mapWorktree(wt.id(), w -> w.withTerminal(w.terminal().running(action.sessionId())));
    return Transition.of(next, activity(state, wt, "session " + action.sessionId() + " started in " + wt.path()));
  }

  Transition spawnFailed(final AppState state, final Action.TerminalSpawnFailed action) {
    final WorktreeState wt = state.worktree(action.worktreeId());
    if (wt == null || wt.terminal().status() != TerminalStatus.SPAWNING) {
      return Transition.unchanged(state);
    }
    final AppState next = state.mapWorktree(wt.id(), w -> w.withTerminal(w.terminal().failed(action.message())));
    return Transition.of(next, activity(state, wt, "spawn failed in " + wt.path() + ": " + action.message()));
  }

  Transition resize(final AppState state, final Action.ResizeTerminal action) {
    final WorktreeState wt = state.worktreeBySession(action.sessionId());
    AppState next = state;
    if (wt != null && (wt.terminal().cols() != action.cols() || wt.terminal().rows() != action.rows())) {
      next = state.mapWorktree(wt.id(), w -> w.withTerminal(w.terminal().resized(action.cols(), action.rows())));
    }
    return Transition.of(next, new Effect.ResizeSession(action.sessionId(), action.cols(), action.rows()));
  }

  Transition write(final AppState state, final Action.WriteTerminal action) {
    return Transition.of(state, new Effect.WriteSession(action.sessionId(), action.data()));
  }

  Transition kill(final AppState state, final Action.KillTerminal action) {
    final WorktreeState wt = state.worktreeBySession(action.sessionId());
    if (wt == null) {
      return Transition.of(state, new Effect.KillSession(action.sessionId()));
    }
    final AppState next = state.mapWorktree(wt.id(), w -> w.withTerminal(w.terminal().exited(null)));
    return Transition.of(next,
        new Effect.KillSession(action.sessionId()),
        activity(state, wt, "session " + action.sessionId() + " killed"));
  }

  Transition output(final AppState state, final Action.TerminalOutput action) {
    final WorktreeState wt = state.worktreeBySession(action.sessionId());
    if (wt == null || action.data().isEmpty()) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.mapWorktree(wt.id(),
        w -> w.withTerminal(w.terminal().appendOutput(action.data(), outputChars))));
  }

  Transition exited(final AppState state, final Action.TerminalExited action) {
    final WorktreeState wt = state.worktreeBySession(action.sessionId());
    final List<Effect> effects = new ArrayList<>(2);
    effects.add(new Effect.KillSession(action.sessionId()));
    if (wt == null) {
      return new Transition(state, effects);
    }
    final TerminalState terminal = wt.terminal().exited(action.exitCode());
    effects.add(activity(state, wt, "session " + action.sessionId() + " exited with " + action.exitCode()));
    return new Transition(state.mapWorktree(wt.id(), w -> w.withTerminal(terminal)), effects);
  }

  private static Effect activity(final AppState state, final WorktreeState wt, final String content) {
    final ProjectState project = state.projectOfWorktree(wt.id());
    return new Effect.AppendRecord(RecordKind.ACTIVITY, project.projectKey(), SCOPE, content);
  }
}
