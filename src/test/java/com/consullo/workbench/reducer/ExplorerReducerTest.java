package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ExplorerState;
import com.consullo.workbench.state.FileComment;
import com.consullo.workbench.state.FileEntry;
import com.consullo.workbench.state.FileKind;
import com.consullo.workbench.state.FileTab;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExplorerReducerTest {

  private static final String ROOT = "/repo";

  private final Reducer reducer = new Reducer(10, 1024, 100);
  private AppState state;
  private String worktreeId;

  @BeforeEach
  void setUp() {
    state = reducer.reduce(AppState.initial(), new Action.OpenProject(ROOT)).state();
    worktreeId = state.activeWorktree().id();
  }

  private Transition apply(final Action action) {
    final Transition t = reducer.reduce(state, action);
    state = t.state();
    return t;
  }

  private ExplorerState explorer() {
    return state.activeWorktree().explorer();
  }

  @Test
  @DisplayName("Should request a listing once and serve repeated expands from the cache")
  void expandDirectory_Repeated_LoadsOnce() {
    final Transition first = apply(new Action.ExpandDirectory("/repo/src"));
    final Transition whileLoading = apply(new Action.ExpandDirectory("/repo/src"));
    apply(new Action.SetDirectoryCache(worktreeId, "/repo/src", List.of()));
    apply(new Action.CollapseDirectory("/repo/src"));
    final Transition cached = apply(new Action.ExpandDirectory("/repo/src"));

    assertThat(first.effects()).containsExactly(new Effect.LoadDirectory(worktreeId, "/repo/src"));
    assertThat(whileLoading.effects()).isEmpty();
    assertThat(cached.effects()).isEmpty();
    assertThat(explorer().expandedPaths()).containsExactly("/repo/src");
  }

  @Test
  @DisplayName("Should keep the cached listing when a directory collapses")
  void collapseDirectory_Cached_KeepsCache() {
    apply(new Action.ExpandDirectory("/repo/src"));
    apply(new Action.SetDirectoryCache(worktreeId, "/repo/src", List.of()));

    apply(new Action.CollapseDirectory("/repo/src"));

    assertThat(explorer().expandedPaths()).isEmpty();
    assertThat(explorer().isCached("/repo/src")).isTrue();
  }

  @Test
  @DisplayName("Should evict and reload a directory on refresh")
  void refreshDirectory_Cached_EvictsAndLoads() {
    apply(new Action.ExploreDir(ROOT));
    apply(new Action.SetDirectoryCache(worktreeId, ROOT, List.of()));

    final Transition t = apply(new Action.RefreshDirectory(ROOT));

    assertThat(explorer().isCached(ROOT)).isFalse();
    assertThat(explorer().loadingPaths()).containsExactly(ROOT);
    assertThat(t.effects()).containsExactly(new Effect.LoadDirectory(worktreeId, ROOT));
  }

  @Test
  @DisplayName("Should store listings with directories first, then by name")
  void setDirectoryCache_UnsortedEntries_SortsForDisplay() {
    apply(new Action.ExploreDir(ROOT));
    apply(new Action.SetDirectoryCache(worktreeId, ROOT, List.of(
        new FileEntry("zeta.txt", "/repo/zeta.txt", FileKind.FILE, 3),
        new FileEntry("src", "/repo/src", FileKind.DIRECTORY, 0),
        new FileEntry("Alpha.md", "/repo/Alpha.md", FileKind.FILE, 9))));

    assertThat(explorer().directoryCache().get(ROOT)).extracting(FileEntry::name)
        .containsExactly("src", "Alpha.md", "zeta.txt");
    assertThat(explorer().loadingPaths()).isEmpty();
  }

  @Test
  @DisplayName("Should record a read failure as the global error and stop loading")
  void directoryLoadFailed_Loading_SetsError() {
    apply(new Action.ExpandDirectory("/repo/secret"));

    apply(new Action.DirectoryLoadFailed(worktreeId, "/repo/secret", "Permission denied"));

    assertThat(explorer().loadingPaths()).isEmpty();
    assertThat(state.error().code()).isEqualTo("directory_read_failed");
    assertThat(state.error().context()).isEqualTo("/repo/secret");
  }

  @Test
  @DisplayName("Should drop listings for a worktree that no longer exists")
  void setDirectoryCache_UnknownWorktree_Ignored() {
    final AppState before = state;

    apply(new Action.SetDirectoryCache("wt-gone", ROOT, List.of()));

    assertThat(state).isSameAs(before);
  }

  @Test
  @DisplayName("Should replace the preview tab in place when opening another file")
  void openFile_PreviewPresent_ReplacesPreview() {
    apply(new Action.OpenFile("/repo/A"));
    apply(new Action.PinTab("/repo/A"));
    apply(new Action.OpenFile("/repo/B"));

    apply(new Action.OpenFile("/repo/C"));

    assertThat(explorer().openTabs()).containsExactly(new FileTab("/repo/A", true, 0), FileTab.preview("/repo/C"));
    assertThat(explorer().activeTabPath()).isEqualTo("/repo/C");
  }

  @Test
  @DisplayName("Should only activate a tab that is already open")
  void openFile_AlreadyOpen_ActivatesWithoutChangingTabs() {
    apply(new Action.OpenFile("/repo/A"));
    apply(new Action.PinTab("/repo/A"));
    apply(new Action.OpenFile("/repo/B"));

    apply(new Action.OpenFile("/repo/A"));

    assertThat(explorer().openTabs()).extracting(FileTab::path).containsExactly("/repo/A", "/repo/B");
    assertThat(explorer().activeTabPath()).isEqualTo("/repo/A");
  }

  @Test
  @DisplayName("Should never hold more than one preview tab")
  void tabs_RandomSequence_AtMostOnePreview() {
    final Random random = new Random(42L);
    final List<String> files = List.of("/repo/a", "/repo/b", "/repo/c", "/repo/d", "/repo/e");
    for (int i = 0; i < 500; i++) {
      final String path = files.get(random.nextInt(files.size()));
      switch (random.nextInt(4)) {
        case 0, 1 -> apply(new Action.OpenFile(path));
        case 2 -> apply(new Action.PinTab(path));
        default -> apply(new Action.CloseTab(path));
      }
      final List<FileTab> tabs = explorer().openTabs();
      assertThat(tabs.stream().filter(tab -> !tab.pinned()).count()).isLessThanOrEqualTo(1);
      assertThat(tabs.stream().map(FileTab::path).distinct().count()).isEqualTo(tabs.size());
      final String active = explorer().activeTabPath();
      if (tabs.isEmpty()) {
        assertThat(active).isNull();
      } else {
        assertThat(tabs).extracting(FileTab::path).contains(active);
      }
    }
  }

  @Test
  @DisplayName("Should activate the neighbour when the active tab closes")
  void closeTab_Active_ActivatesNeighbour() {
    for (final String path : List.of("/repo/a", "/repo/b", "/repo/c")) {
      apply(new Action.OpenFile(path));
      apply(new Action.PinTab(path));
    }
    apply(new Action.SwitchTab("/repo/b"));

    apply(new Action.CloseTab("/repo/b"));
    assertThat(explorer().activeTabPath()).isEqualTo("/repo/c");

    apply(new Action.CloseTab("/repo/c"));
    assertThat(explorer().activeTabPath()).isEqualTo("/repo/a");

    apply(new Action.CloseTab("/repo/a"));
    assertThat(explorer().openTabs()).isEmpty();
    assertThat(explorer().activeTabPath()).isNull();
  }

  @Test
  @DisplayName("Should keep the active tab when another tab closes")
  void closeTab_Inactive_KeepsActive() {
    apply(new Action.OpenFile("/repo/a"));
    apply(new Action.PinTab("/repo/a"));
    apply(new Action.OpenFile("/repo/b"));

    apply(new Action.CloseTab("/repo/a"));

    assertThat(explorer().activeTabPath()).isEqualTo("/repo/b");
  }

  @Test
  @DisplayName("Should remember the scroll position per tab")
  void setTabScroll_OpenTab_StoresPosition() {
    apply(new Action.OpenFile("/repo/a"));

    apply(new Action.SetTabScroll("/repo/a", 120));
    final AppState before = state;
    apply(new Action.SetTabScroll("/repo/missing", 5));

    assertThat(explorer().openTabs().get(0).scrollPosition()).isEqualTo(120);
    assertThat(state).isSameAs(before);
  }

  @Test
  @DisplayName("Should load comments for a selected file and ignore comments for a stale selection")
  void selectFile_ThenComments_AppliesOnlyToSelection() {
    final Transition select = apply(new Action.SelectFile("/repo/a"));
    final FileComment note = new FileComment(1L, "/repo/a", "check this", Instant.ofEpochMilli(1_000L));

    apply(new Action.SetFileComments(worktreeId, "/repo/other", List.of(note)));
    assertThat(explorer().selectedComments()).isEmpty();

    apply(new Action.SetFileComments(worktreeId, "/repo/a", List.of(note)));
    assertThat(explorer().selectedComments()).containsExactly(note);
    assertThat(select.effects()).containsExactly(
        new Effect.LoadComments(worktreeId, state.activeProject().projectKey(), "/repo/a"));
  }

  @Test
  @DisplayName("Should persist a comment and refresh the selection it belongs to")
  void addFileComment_SelectedPath_AppendsAndReloads() {
    apply(new Action.SelectFile("/repo/a"));

    final Transition t = apply(new Action.AddFileComment("/repo/a", "looks wrong"));
    final Transition other = apply(new Action.AddFileComment("/repo/b", "fine"));

    assertThat(t.effects()).containsExactly(
        new Effect.AppendRecord(RecordKind.COMMENT, state.activeProject().projectKey(), "/repo/a", "looks wrong"),
        new Effect.LoadComments(worktreeId, state.activeProject().projectKey(), "/repo/a"));
    assertThat(other.effects()).hasSize(1);
  }

  @Test
  @DisplayName("Should delete a comment within the active project only")
  void deleteFileComment_Any_EmitsScopedDelete() {
    final Transition t = apply(new Action.DeleteFileComment("/repo/a", 7L));

    assertThat(t.effects()).containsExactly(
        new Effect.DeleteRecord(RecordKind.COMMENT, state.activeProject().projectKey(), 7L));
  }

  @Test
  @DisplayName("Should do nothing without an open project")
  void explorerActions_NoProject_AreNoOps() {
    final AppState empty = AppState.initial();
    final List<Action> actions = new ArrayList<>(List.of(
        new Action.ExploreDir("/x"), new Action.OpenFile("/x/a"), new Action.SelectFile("/x/a"),
        new Action.AddFileComment("/x/a", "c")));

    for (final Action action : actions) {
      final Transition t = reducer.reduce(empty, action);
      assertThat(t.state()).isSameAs(empty);
      assertThat(t.effects()).isEmpty();
    }
  }
}
