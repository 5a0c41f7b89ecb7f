package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.AppError;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ContainerServicesState;
import com.consullo.workbench.state.EnvConfig;
import com.consullo.workbench.state.ProjectState;
import com.consullo.workbench.state.RecentProject;
import com.consullo.workbench.state.WorktreeState;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Transitions for projects, worktrees and application-wide state.
 */
final class ProjectReducer {

  static final String SCOPE = "project";
  static final String ENV_SCOPE = "env";

  private final int maxRecentProjects;

  ProjectReducer(final int maxRecentProjects) {
    this.maxRecentProjects = maxRecentProjects;
  }

  Transition openProject(final AppState state, final Action.OpenProject action) {
    final String path = Path.of(action.path()).normalize().toString();
    final int existing = state.indexOfProject(path);
    if (existing >= 0) {
      final ProjectState project = state.projects().get(existing);
      return Transition.unchanged(state.withProjects(state.projects(), existing)
          .withRecentProjects(touchRecent(state.recentProjects(), project)));
    }

    final ProjectState project = ProjectState.open(path);
    final List<ProjectState> projects = new ArrayList<>(state.projects());
    projects.add(project);
    final AppState next = state.withProjects(projects, projects.size() - 1)
        .withRecentProjects(touchRecent(state.recentProjects(), project));
    return Transition.of(next,
        new Effect.AppendRecord(RecordKind.ACTIVITY, project.projectKey(), SCOPE, "opened " + path));
  }

  Transition closeProject(final AppState state, final Action.CloseProject action) {
    final int index = action.index();
    if (index >= state.projects().size()) {
      return Transition.unchanged(state);
    }
    final ProjectState closed = state.projects().get(index);
    final List<ProjectState> projects = new ArrayList<>(state.projects());
    projects.remove(index);

    final List<Effect> effects = new ArrayList<>();
    for (final WorktreeState w : closed.worktrees()) {
      effects.add(new Effect.KillWorktreeSessions(w.id()));
      effects.add(new Effect.CancelCompletion(w.id()));
    }
    effects.add(new Effect.AppendRecord(RecordKind.ACTIVITY, closed.projectKey(), SCOPE, "closed " + closed.path()));
    return new Transition(
        state.withProjects(projects, indexAfterRemoval(state.activeProjectIndex(), index, projects.size())),
        effects);
  }

  Transition switchProject(final AppState state, final Action.SwitchProject action) {
    if (action.index() >= state.projects().size() || action.index() == state.activeProjectIndex()) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.withProjects(state.projects(), action.index()));
  }

  Transition addWorktree(final AppState state, final Action.AddWorktree action) {
    final ProjectState project = state.activeProject();
    if (project == null) {
      return Transition.unchanged(state);
    }
    final String path = Path.of(action.path()).normalize().toString();
    final String id = WorktreeState.idFor(path);
    for (int i = 0; i < project.worktrees().size(); i++) {
      if (project.worktrees().get(i).id().equals(id)) {
        final int found = i;
        return Transition.unchanged(state.mapProject(state.activeProjectIndex(),
            p -> p.withWorktrees(p.worktrees(), found)));
      }
    }
    final WorktreeState added = WorktreeState.create(path, action.branch(), false);
    final List<WorktreeState> worktrees = new ArrayList<>(project.worktrees());
    worktrees.add(added);
    final AppState next = state.mapProject(state.activeProjectIndex(),
        p -> p.withWorktrees(worktrees, worktrees.size() - 1));

    final List<Effect> effects = new ArrayList<>(2);
    effects.add(new Effect.AppendRecord(RecordKind.ACTIVITY, project.projectKey(), SCOPE,
        "added worktree " + path + " on " + action.branch()));
    if (project.envConfig().autoCopy()) {
      final Effect copy = envCopy(project.envConfig(), added);
      if (copy != null) {
        effects.add(copy);
      }
    }
    return new Transition(next, effects);
  }

  Transition removeWorktree(final AppState state, final Action.RemoveWorktree action) {
    final ProjectState project = state.projectOfWorktree(action.worktreeId());
    if (project == null) {
      return Transition.unchanged(state);
    }
    final WorktreeState removed = project.worktree(action.worktreeId());
    if (removed.main()) {
      return Transition.unchanged(state.withError(
          new AppError("main_worktree", "The main worktree cannot be removed", removed.path())));
    }
    final int removedIndex = project.worktrees().indexOf(removed);
    final List<WorktreeState> worktrees = new ArrayList<>(project.worktrees());
    worktrees.remove(removedIndex);
    final int active = indexAfterRemoval(project.activeWorktreeIndex(), removedIndex, worktrees.size());

    final AppState next = state.mapProject(state.projects().indexOf(project), p -> p.withWorktrees(worktrees, active));
    return Transition.of(next,
        new Effect.KillWorktreeSessions(removed.id()),
        new Effect.CancelCompletion(removed.id()),
        new Effect.AppendRecord(RecordKind.ACTIVITY, project.projectKey(), SCOPE, "removed worktree " + removed.path()));
  }

  Transition switchWorktree(final AppState state, final Action.SwitchWorktree action) {
    final ProjectState project = state.activeProject();
    if (project == null || action.index() >= project.worktrees().size()
        || action.index() == project.activeWorktreeIndex()) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.mapProject(state.activeProjectIndex(),
        p -> p.withWorktrees(p.worktrees(), action.index())));
  }

  Transition setActiveView(final AppState state, final Action.SetActiveView action) {
    return Transition.unchanged(action.view() == state.activeView() ? state : state.withActiveView(action.view()));
  }

  Transition setContainerServices(final AppState state, final Action.SetContainerServices action) {
    final ContainerServicesState services = new ContainerServicesState(action.available(), action.services());
    return Transition.unchanged(services.equals(state.containerServices())
        ? state : state.withContainerServices(services));
  }

  Transition setError(final AppState state, final Action.SetError action) {
    return Transition.unchanged(state.withError(new AppError(action.code(), action.message(), action.context())));
  }

  Transition clearError(final AppState state) {
    return Transition.unchanged(state.error() == null ? state : state.withError(null));
  }

  Transition setEnvTrackedPatterns(final AppState state, final Action.SetEnvTrackedPatterns action) {
    final ProjectState project = state.activeProject();
    if (project == null || project.envConfig().trackedPatterns().equals(action.patterns())) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.mapProject(state.activeProjectIndex(),
        p -> p.withEnvConfig(p.envConfig().withTrackedPatterns(action.patterns()))));
  }

  Transition setEnvAutoCopy(final AppState state, final Action.SetEnvAutoCopy action) {
    final ProjectState project = state.activeProject();
    if (project == null || project.envConfig().autoCopy() == action.enabled()) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.mapProject(state.activeProjectIndex(),
        p -> p.withEnvConfig(p.envConfig().withAutoCopy(action.enabled()))));
  }

  Transition setEnvSourceWorktree(final AppState state, final Action.SetEnvSourceWorktree action) {
    final ProjectState project = state.activeProject();
    if (project == null) {
      return Transition.unchanged(state);
    }
    final String path = Path.of(action.path()).normalize().toString();
    if (project.worktreeAt(path) == null) {
      return Transition.unchanged(state.withError(
          new AppError("env_source", "Not a worktree of " + project.name(), path)));
    }
    if (path.equals(project.envConfig().sourceWorktree())) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.mapProject(state.activeProjectIndex(),
        p -> p.withEnvConfig(p.envConfig().withSourceWorktree(path))));
  }

  Transition copyEnvFiles(final AppState state, final Action.CopyEnvFiles action) {
    final ProjectState project = state.projectOfWorktree(action.worktreeId());
    if (project == null) {
      return Transition.unchanged(state);
    }
    final Effect copy = envCopy(project.envConfig(), project.worktree(action.worktreeId()));
    return copy == null ? Transition.unchanged(state) : Transition.of(state, copy);
  }

  Transition envFilesCopied(final AppState state, final Action.EnvFilesCopied action) {
    final ProjectState project = state.projectOfWorktree(action.worktreeId());
    if (project == null) {
      return Transition.unchanged(state);
    }
    final String target = project.worktree(action.worktreeId()).path();
    final List<Effect> effects = new ArrayList<>(2);
    effects.add(new Effect.AppendRecord(RecordKind.ACTIVITY, project.projectKey(), ENV_SCOPE,
        action.copied().isEmpty() ? "no env files copied to " + target
            : "copied " + String.join(", ", action.copied()) + " to " + target));
    if (action.failed().isEmpty()) {
      return new Transition(state, effects);
    }
    final String detail = String.join("; ", action.failed());
    effects.add(new Effect.AppendRecord(RecordKind.ACTIVITY, project.projectKey(), ENV_SCOPE,
        "failed to copy to " + target + ": " + detail));
    return new Transition(state.withError(
        new AppError("env_copy_failed", "Some env files could not be copied to " + target, detail)), effects);
  }

  // null when there is nothing to copy: no patterns, or the target is the source itself
  private static Effect envCopy(final EnvConfig config, final WorktreeState target) {
    if (config.trackedPatterns().isEmpty() || target.path().equals(config.sourceWorktree())) {
      return null;
    }
    return new Effect.CopyEnvFiles(target.id(), config.sourceWorktree(), target.path(), config.trackedPatterns());
  }

  private List<RecentProject> touchRecent(final List<RecentProject> recent, final ProjectState project) {
    final List<RecentProject> next = new ArrayList<>(recent.size() + 1);
    next.add(new RecentProject(project.path(), project.name()));
    for (final RecentProject r : recent) {
      if (next.size() >= maxRecentProjects) {
        break;
      }
      if (!r.path().equals(project.path())) {
        next.add(r);
      }
    }
    return next;
  }

  static int indexAfterRemoval(final int active, final int removed, final int remaining) {
    if (remaining == 0) {
      return 0;
    }
    if (removed < active) {
      return active - 1;
    }
    return Math.min(active, remaining - 1);
  }
}
