package com.consullo.workbench.state;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.Validate;

/**
 * Root of the state tree.
 *
 * <p>Every committed transition produces a new {@code AppState}; unchanged subtrees are shared with the previous
 * version and no version is mutated once produced.
 *
 * @param version application version
 * @param projects open projects
 * @param activeProjectIndex index of the active project (0 when none is open)
 * @param activeView selected main view
 * @param recentProjects most recently opened projects, newest first
 * @param containerServices global container service state
 * @param error global error, or {@code null}
 * @since 1.0
 */
public record AppState(
    String version,
    List<ProjectState> projects,
    int activeProjectIndex,
    ActiveView activeView,
    List<RecentProject> recentProjects,
    ContainerServicesState containerServices,
    AppError error) {

  public static final String VERSION = "1.0.0";

  public AppState {
    version = version == null ? VERSION : version;
    projects = projects == null ? List.of() : List.copyOf(projects);
    Validate.isTrue(activeProjectIndex >= 0, "activeProjectIndex must not be negative");
    Validate.isTrue(projects.isEmpty() || activeProjectIndex < projects.size(),
        "activeProjectIndex out of range: %s", activeProjectIndex);
    activeView = activeView == null ? ActiveView.WORKFLOWS : activeView;
    recentProjects = recentProjects == null ? List.of() : List.copyOf(recentProjects);
    containerServices = containerServices == null ? ContainerServicesState.UNKNOWN : containerServices;
  }

  public static AppState initial() {
    return new AppState(VERSION, List.of(), 0, ActiveView.WORKFLOWS, List.of(), ContainerServicesState.UNKNOWN,
        null);
  }

  public ProjectState activeProject() {
    return projects.isEmpty() ? null : projects.get(activeProjectIndex);
  }

  public WorktreeState activeWorktree() {
    final ProjectState project = activeProject();
    return project == null ? null : project.activeWorktree();
  }

  public int indexOfProject(final String path) {
    for (int i = 0; i < projects.size(); i++) {
      if (projects.get(i).path().equals(path)) {
        return i;
      }
    }
    return -1;
  }

  public ProjectState projectOfWorktree(final String worktreeId) {
    for (final ProjectState p : projects) {
      if (p.worktree(worktreeId) != null) {
        return p;
      }
    }
    return null;
  }

  public WorktreeState worktree(final String worktreeId) {
    final ProjectState project = projectOfWorktree(worktreeId);
    return project == null ? null : project.worktree(worktreeId);
  }

  public WorktreeState worktreeBySession(final String sessionId) {
    for (final ProjectState p : projects) {
      for (final WorktreeState w : p.worktrees()) {
        if (sessionId.equals(w.terminal().sessionId())) {
          return w;
        }
      }
    }
    return null;
  }

  public AppState withProjects(final List<ProjectState> next, final int activeIndex) {
    return new AppState(version, next, activeIndex, activeView, recentProjects, containerServices, error);
  }

  public AppState withActiveView(final ActiveView view) {
    return new AppState(version, projects, activeProjectIndex, view, recentProjects, containerServices, error);
  }

  public AppState withRecentProjects(final List<RecentProject> recent) {
    return new AppState(version, projects, activeProjectIndex, activeView, recent, containerServices, error);
  }

  public AppState withContainerServices(final ContainerServicesState services) {
    return new AppState(version, projects, activeProjectIndex, activeView, recentProjects, services, error);
  }

  public AppState withError(final AppError next) {
    return new AppState(version, projects, activeProjectIndex, activeView, recentProjects, containerServices, next);
  }

  /**
   * Replaces one worktree wherever it lives. Returns {@code this} when the worktree is unknown or unchanged.
   *
   * @param worktreeId worktree id
   * @param update update function
   * @return updated state
   */
  public AppState mapWorktree(final String worktreeId, final UnaryOperator<WorktreeState> update) {
    final List<ProjectState> next = new ArrayList<>(projects.size());
    boolean changed = false;
    for (final ProjectState p : projects) {
      final ProjectState updated = p.mapWorktree(worktreeId, update);
      changed |= updated != p;
      next.add(updated);
    }
    return changed ? withProjects(next, activeProjectIndex) : this;
  }

  public AppState mapProject(final int index, final UnaryOperator<ProjectState> update) {
    final ProjectState current = projects.get(index);
    final ProjectState updated = update.apply(current);
    if (updated == current) {
      return this;
    }
    final List<ProjectState> next = new ArrayList<>(projects);
    next.set(index, updated);
    return withProjects(next, activeProjectIndex);
  }
}
