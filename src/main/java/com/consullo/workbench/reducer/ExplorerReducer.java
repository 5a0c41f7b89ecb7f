package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.AppError;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ExplorerState;
import com.consullo.workbench.state.FileEntry;
import com.consullo.workbench.state.FileTab;
import com.consullo.workbench.state.ProjectState;
import com.consullo.workbench.state.WorktreeState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explorer transitions: lazy directory cache, tab selection and file comments.
 *
 * <p>User actions address the active worktree of the active project. Follow-ups name their worktree and are dropped
 * when it no longer exists.
 */
final class ExplorerReducer {

  Transition exploreDir(final AppState state, final Action.ExploreDir action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final ExplorerState explorer = wt.explorer().withCurrentPath(action.path());
    return loadIfAbsent(state, wt, explorer, action.path());
  }

  Transition expandDirectory(final AppState state, final Action.ExpandDirectory action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    ExplorerState explorer = wt.explorer();
    if (!explorer.expandedPaths().contains(action.path())) {
      final Set<String> expanded = new LinkedHashSet<>(explorer.expandedPaths());
      expanded.add(action.path());
      explorer = explorer.withExpandedPaths(expanded);
    }
    return loadIfAbsent(state, wt, explorer, action.path());
  }

  Transition collapseDirectory(final AppState state, final Action.CollapseDirectory action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null || !wt.explorer().expandedPaths().contains(action.path())) {
      return Transition.unchanged(state);
    }
    final Set<String> expanded = new LinkedHashSet<>(wt.explorer().expandedPaths());
    expanded.remove(action.path());
    return Transition.unchanged(replace(state, wt, wt.explorer().withExpandedPaths(expanded)));
  }

  Transition refreshDirectory(final AppState state, final Action.RefreshDirectory action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    ExplorerState explorer = wt.explorer();
    if (explorer.isCached(action.path())) {
      final Map<String, List<FileEntry>> cache = new LinkedHashMap<>(explorer.directoryCache());
      cache.remove(action.path());
      explorer = explorer.withDirectoryCache(cache);
    }
    return loadIfAbsent(state, wt, explorer, action.path());
  }

  Transition setDirectoryCache(final AppState state, final Action.SetDirectoryCache action) {
    final WorktreeState wt = state.worktree(action.worktreeId());
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final List<FileEntry> entries = new ArrayList<>(action.entries());
    entries.sort(FileEntry.DISPLAY_ORDER);
    final Map<String, List<FileEntry>> cache = new LinkedHashMap<>(wt.explorer().directoryCache());
    cache.put(action.path(), entries);
    final ExplorerState explorer = wt.explorer().withDirectoryCache(cache)
        .withLoadingPaths(without(wt.explorer().loadingPaths(), action.path()));
    return Transition.unchanged(replace(state, wt, explorer));
  }

  Transition directoryLoadFailed(final AppState state, final Action.DirectoryLoadFailed action) {
    final WorktreeState wt = state.worktree(action.worktreeId());
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final ExplorerState explorer = wt.explorer()
        .withLoadingPaths(without(wt.explorer().loadingPaths(), action.path()));
    return Transition.unchanged(replace(state, wt, explorer)
        .withError(new AppError("directory_read_failed", action.message(), action.path())));
  }

  /**
   * Opens a file: activates its tab if present, otherwise reuses the preview tab in place, otherwise appends a new
   * preview tab.
   */
  Transition openFile(final AppState state, final Action.OpenFile action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final String path = action.path();
    final List<FileTab> tabs = new ArrayList<>(wt.explorer().openTabs());
    if (indexOfTab(tabs, path) < 0) {
      final int preview = indexOfPreview(tabs);
      if (preview >= 0) {
        tabs.set(preview, FileTab.preview(path));
      } else {
        tabs.add(FileTab.preview(path));
      }
    }
    return Transition.unchanged(replace(state, wt, wt.explorer().withTabs(tabs, path)));
  }

  Transition pinTab(final AppState state, final Action.PinTab action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final List<FileTab> tabs = new ArrayList<>(wt.explorer().openTabs());
    final int index = indexOfTab(tabs, action.path());
    if (index < 0 || tabs.get(index).pinned()) {
      return Transition.unchanged(state);
    }
    tabs.set(index, tabs.get(index).pin());
    return Transition.unchanged(replace(state, wt, wt.explorer().withTabs(tabs, wt.explorer().activeTabPath())));
  }

  Transition closeTab(final AppState state, final Action.CloseTab action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final List<FileTab> tabs = new ArrayList<>(wt.explorer().openTabs());
    final int index = indexOfTab(tabs, action.path());
    if (index < 0) {
      return Transition.unchanged(state);
    }
    tabs.remove(index);
    String active = wt.explorer().activeTabPath();
    if (action.path().equals(active)) {
      if (tabs.isEmpty()) {
        active = null;
      } else {
        active = tabs.get(Math.min(index, tabs.size() - 1)).path();
      }
    }
    return Transition.unchanged(replace(state, wt, wt.explorer().withTabs(tabs, active)));
  }

  Transition switchTab(final AppState state, final Action.SwitchTab action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null || indexOfTab(wt.explorer().openTabs(), action.path()) < 0
        || action.path().equals(wt.explorer().activeTabPath())) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(replace(state, wt, wt.explorer().withTabs(wt.explorer().openTabs(), action.path())));
  }

  Transition setTabScroll(final AppState state, final Action.SetTabScroll action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final List<FileTab> tabs = new ArrayList<>(wt.explorer().openTabs());
    final int index = indexOfTab(tabs, action.path());
    if (index < 0 || tabs.get(index).scrollPosition() == action.position()) {
      return Transition.unchanged(state);
    }
    tabs.set(index, tabs.get(index).withScrollPosition(action.position()));
    return Transition.unchanged(replace(state, wt, wt.explorer().withTabs(tabs, wt.explorer().activeTabPath())));
  }

  Transition selectFile(final AppState state, final Action.SelectFile action) {
    final ProjectState project = state.activeProject();
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final AppState next = replace(state, wt, wt.explorer().withSelection(action.path(), List.of()));
    return Transition.of(next, new Effect.LoadComments(wt.id(), project.projectKey(), action.path()));
  }

  Transition setFileComments(final AppState state, final Action.SetFileComments action) {
    final WorktreeState wt = state.worktree(action.worktreeId());
    if (wt == null || !action.path().equals(wt.explorer().selectedPath())) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(replace(state, wt, wt.explorer().withSelection(action.path(), action.comments())));
  }

  Transition addFileComment(final AppState state, final Action.AddFileComment action) {
    final ProjectState project = state.activeProject();
    if (project == null) {
      return Transition.unchanged(state);
    }
    final WorktreeState wt = project.activeWorktree();
    final List<Effect> effects = new ArrayList<>(2);
    effects.add(new Effect.AppendRecord(RecordKind.COMMENT, project.projectKey(), action.path(), action.content()));
    if (action.path().equals(wt.explorer().selectedPath())) {
      effects.add(new Effect.LoadComments(wt.id(), project.projectKey(), action.path()));
    }
    return new Transition(state, effects);
  }

  Transition deleteFileComment(final AppState state, final Action.DeleteFileComment action) {
    final ProjectState project = state.activeProject();
    if (project == null) {
      return Transition.unchanged(state);
    }
    final WorktreeState wt = project.activeWorktree();
    final List<Effect> effects = new ArrayList<>(2);
    effects.add(new Effect.DeleteRecord(RecordKind.COMMENT, project.projectKey(), action.commentId()));
    if (action.path().equals(wt.explorer().selectedPath())) {
      effects.add(new Effect.LoadComments(wt.id(), project.projectKey(), action.path()));
    }
    return new Transition(state, effects);
  }

  private static Transition loadIfAbsent(final AppState state, final WorktreeState wt, final ExplorerState explorer,
      final String path) {
    if (explorer.isCached(path) || explorer.loadingPaths().contains(path)) {
      return Transition.unchanged(replace(state, wt, explorer));
    }
    final Set<String> loading = new LinkedHashSet<>(explorer.loadingPaths());
    loading.add(path);
    return Transition.of(replace(state, wt, explorer.withLoadingPaths(loading)),
        new Effect.LoadDirectory(wt.id(), path));
  }

  private static AppState replace(final AppState state, final WorktreeState wt, final ExplorerState explorer) {
    if (explorer.equals(wt.explorer())) {
      return state;
    }
    return state.mapWorktree(wt.id(), w -> w.withExplorer(explorer));
  }

  private static Set<String> without(final Set<String> paths, final String path) {
    final Set<String> next = new LinkedHashSet<>(paths);
    next.remove(path);
    return next;
  }

  private static int indexOfTab(final List<FileTab> tabs, final String path) {
    for (int i = 0; i < tabs.size(); i++) {
      if (tabs.get(i).path().equals(path)) {
        return i;
      }
    }
    return -1;
  }

  private static int indexOfPreview(final List<FileTab> tabs) {
    for (int i = 0; i < tabs.size(); i++) {
      if (!tabs.get(i).pinned()) {
        return i;
      }
    }
    return -1;
  }
}
