package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.ActiveView;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.EnvConfig;
import com.consullo.workbench.state.RecentProject;
import com.consullo.workbench.state.WorktreeState;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ProjectReducerTest {

  private final Reducer reducer = new Reducer(3, 1024, 100);

  private AppState apply(final AppState start, final Action... actions) {
    AppState state = start;
    for (final Action action : actions) {
      state = reducer.reduce(state, action).state();
    }
    return state;
  }

  @Test
  @DisplayName("Should add a project with a main worktree and make it active")
  void openProject_NewPath_AddsActiveProject() {
    final Transition t = reducer.reduce(AppState.initial(), new Action.OpenProject("/work/alpha/./"));

    final AppState state = t.state();
    assertThat(state.projects()).hasSize(1);
    assertThat(state.activeProject().path()).isEqualTo("/work/alpha");
    assertThat(state.activeProject().name()).isEqualTo("alpha");
    final WorktreeState main = state.activeWorktree();
    assertThat(main.main()).isTrue();
    assertThat(main.path()).isEqualTo("/work/alpha");
    assertThat(state.recentProjects()).containsExactly(new RecentProject("/work/alpha", "alpha"));
    assertThat(t.effects()).singleElement().isInstanceOfSatisfying(Effect.AppendRecord.class,
        e -> assertThat(e.kind()).isEqualTo(RecordKind.ACTIVITY));
  }

  @Test
  @DisplayName("Should activate an already open project instead of adding it twice")
  void openProject_AlreadyOpen_ActivatesExisting() {
    final AppState opened = apply(AppState.initial(),
        new Action.OpenProject("/work/alpha"), new Action.OpenProject("/work/beta"));

    final Transition t = reducer.reduce(opened, new Action.OpenProject("/work/alpha"));

    assertThat(t.state().projects()).hasSize(2);
    assertThat(t.state().activeProjectIndex()).isZero();
    assertThat(t.state().recentProjects()).extracting(RecentProject::path)
        .containsExactly("/work/alpha", "/work/beta");
    assertThat(t.effects()).isEmpty();
  }

  @Test
  @DisplayName("Should cap the recent project list and keep the newest first")
  void openProject_ManyProjects_CapsRecentList() {
    final AppState state = apply(AppState.initial(),
        new Action.OpenProject("/p/a"), new Action.OpenProject("/p/b"),
        new Action.OpenProject("/p/c"), new Action.OpenProject("/p/d"));

    assertThat(state.recentProjects()).extracting(RecentProject::path).containsExactly("/p/d", "/p/c", "/p/b");
  }

  @Test
  @DisplayName("Should kill sessions of every worktree when a project closes")
  void closeProject_WithWorktrees_EmitsKillsAndFixesActiveIndex() {
    final AppState opened = apply(AppState.initial(),
        new Action.OpenProject("/p/a"), new Action.AddWorktree("/p/a-feature", "feature"),
        new Action.OpenProject("/p/b"));
    final WorktreeState main = opened.projects().get(0).worktrees().get(0);
    final WorktreeState feature = opened.projects().get(0).worktrees().get(1);

    final Transition t = reducer.reduce(opened, new Action.CloseProject(0));

    assertThat(t.state().projects()).hasSize(1);
    assertThat(t.state().activeProject().path()).isEqualTo("/p/b");
    assertThat(t.effects()).contains(
        new Effect.KillWorktreeSessions(main.id()),
        new Effect.KillWorktreeSessions(feature.id()),
        new Effect.CancelCompletion(main.id()),
        new Effect.CancelCompletion(feature.id()));
  }

  @Test
  @DisplayName("Should ignore out of range project indexes")
  void closeAndSwitch_OutOfRange_AreNoOps() {
    final AppState opened = apply(AppState.initial(), new Action.OpenProject("/p/a"));

    assertThat(reducer.reduce(opened, new Action.CloseProject(5)).state()).isSameAs(opened);
    assertThat(reducer.reduce(opened, new Action.SwitchProject(5)).state()).isSameAs(opened);
  }

  @Test
  @DisplayName("Should refuse to remove the main worktree and report why")
  void removeWorktree_Main_SetsError() {
    final AppState opened = apply(AppState.initial(), new Action.OpenProject("/p/a"));
    final String mainId = opened.activeWorktree().id();

    final Transition t = reducer.reduce(opened, new Action.RemoveWorktree(mainId));

    assertThat(t.state().activeProject().worktrees()).hasSize(1);
    assertThat(t.state().error().code()).isEqualTo("main_worktree");
    assertThat(t.effects()).isEmpty();
  }

  @Test
  @DisplayName("Should remove a secondary worktree and stop its sessions")
  void removeWorktree_Secondary_RemovesAndKills() {
    final AppState opened = apply(AppState.initial(),
        new Action.OpenProject("/p/a"), new Action.AddWorktree("/p/a-fix", "fix"));
    final String fixId = opened.activeWorktree().id();

    final Transition t = reducer.reduce(opened, new Action.RemoveWorktree(fixId));

    assertThat(t.state().activeProject().worktrees()).hasSize(1);
    assertThat(t.state().activeWorktree().main()).isTrue();
    assertThat(t.effects()).contains(new Effect.KillWorktreeSessions(fixId), new Effect.CancelCompletion(fixId));
  }

  @Test
  @DisplayName("Should switch to an existing worktree instead of adding a duplicate")
  void addWorktree_ExistingPath_Switches() {
    final AppState opened = apply(AppState.initial(),
        new Action.OpenProject("/p/a"), new Action.AddWorktree("/p/a-fix", "fix"), new Action.SwitchWorktree(0));

    final Transition t = reducer.reduce(opened, new Action.AddWorktree("/p/a-fix", "fix"));

    assertThat(t.state().activeProject().worktrees()).hasSize(2);
    assertThat(t.state().activeProject().activeWorktreeIndex()).isEqualTo(1);
    assertThat(t.effects()).isEmpty();
  }

  @Test
  @DisplayName("Should return the same state when nothing changes")
  void setActiveView_SameView_ReturnsSameInstance() {
    final AppState state = reducer.reduce(AppState.initial(), new Action.SetActiveView(ActiveView.CHAT)).state();

    assertThat(state.activeView()).isEqualTo(ActiveView.CHAT);
    assertThat(reducer.reduce(state, new Action.SetActiveView(ActiveView.CHAT)).state()).isSameAs(state);
    assertThat(reducer.reduce(state, new Action.ClearError()).state()).isSameAs(state);
  }

  @Test
  @DisplayName("Should set and clear the global error")
  void setError_ThenClear_RoundTrips() {
    final AppState failed = reducer.reduce(AppState.initial(), new Action.SetError("boom", "it broke", "ctx")).state();

    assertThat(failed.error().message()).isEqualTo("it broke");
    assertThat(reducer.reduce(failed, new Action.ClearError()).state()).isEqualTo(AppState.initial());
  }

  @Test
  @DisplayName("Should compute the active index after a removal")
  void indexAfterRemoval_Cases_KeepSelectionStable() {
    assertThat(ProjectReducer.indexAfterRemoval(2, 0, 3)).isEqualTo(1);
    assertThat(ProjectReducer.indexAfterRemoval(1, 1, 2)).isEqualTo(1);
    assertThat(ProjectReducer.indexAfterRemoval(2, 2, 2)).isEqualTo(1);
    assertThat(ProjectReducer.indexAfterRemoval(0, 0, 0)).isZero();
  }

  @Test
  @DisplayName("Should give equal results for equal inputs")
  void reduce_SameInputs_Deterministic() {
    final Action[] script = {
        new Action.OpenProject("/p/a"), new Action.AddWorktree("/p/a-fix", "fix"),
        new Action.OpenFile("/p/a-fix/README.md"), new Action.SubmitChatMessage("hello"),
        new Action.SpawnTerminal(WorktreeState.idFor("/p/a-fix"), 100, 30)};

    final AppState first = apply(AppState.initial(), script);
    final AppState second = apply(AppState.initial(), script);

    assertThat(first).isEqualTo(second);
  }

  @Test
  @DisplayName("Should copy tracked env files into a new worktree when auto copy is on")
  void addWorktree_AutoCopyOn_SchedulesEnvCopy() {
    final AppState opened = apply(AppState.initial(), new Action.OpenProject("/p/a"));

    final Transition t = reducer.reduce(opened, new Action.AddWorktree("/p/a-fix", "fix"));

    assertThat(t.effects()).contains(new Effect.CopyEnvFiles(WorktreeState.idFor("/p/a-fix"), "/p/a", "/p/a-fix",
        EnvConfig.DEFAULT_PATTERNS));
  }

  @Test
  @DisplayName("Should not copy env files when auto copy is off")
  void addWorktree_AutoCopyOff_NoEnvCopy() {
    final AppState opened = apply(AppState.initial(), new Action.OpenProject("/p/a"),
        new Action.SetEnvAutoCopy(false));

    final Transition t = reducer.reduce(opened, new Action.AddWorktree("/p/a-fix", "fix"));

    assertThat(opened.activeProject().envConfig().autoCopy()).isFalse();
    assertThat(t.effects()).noneMatch(e -> e instanceof Effect.CopyEnvFiles);
  }

  @Test
  @DisplayName("Should update tracked patterns and source worktree of the active project")
  void envConfig_Updates_AppliedToActiveProject() {
    final AppState state = apply(AppState.initial(), new Action.OpenProject("/p/a"),
        new Action.AddWorktree("/p/a-fix", "fix"),
        new Action.SetEnvTrackedPatterns(List.of(".env", ".claude/")),
        new Action.SetEnvSourceWorktree("/p/a-fix/"));

    final EnvConfig env = state.activeProject().envConfig();
    assertThat(env.trackedPatterns()).containsExactly(".env", ".claude/");
    assertThat(env.sourceWorktree()).isEqualTo("/p/a-fix");
    assertThat(env.autoCopy()).isTrue();
  }

  @Test
  @DisplayName("Should reject a source that is not one of the project's worktrees")
  void setEnvSourceWorktree_UnknownPath_SetsError() {
    final AppState opened = apply(AppState.initial(), new Action.OpenProject("/p/a"));

    final AppState state = apply(opened, new Action.SetEnvSourceWorktree("/elsewhere"));

    assertThat(state.error().code()).isEqualTo("env_source");
    assertThat(state.activeProject().envConfig().sourceWorktree()).isEqualTo("/p/a");
  }

  @Test
  @DisplayName("Should copy on request and do nothing for the source worktree itself")
  void copyEnvFiles_Requested_SchedulesCopyUnlessSource() {
    final AppState state = apply(AppState.initial(), new Action.OpenProject("/p/a"),
        new Action.AddWorktree("/p/a-fix", "fix"));
    final String fixId = WorktreeState.idFor("/p/a-fix");

    final Transition copy = reducer.reduce(state, new Action.CopyEnvFiles(fixId));
    final Transition self = reducer.reduce(state, new Action.CopyEnvFiles(WorktreeState.idFor("/p/a")));

    assertThat(copy.state()).isSameAs(state);
    assertThat(copy.effects()).containsExactly(
        new Effect.CopyEnvFiles(fixId, "/p/a", "/p/a-fix", EnvConfig.DEFAULT_PATTERNS));
    assertThat(self.effects()).isEmpty();
  }

  @Test
  @DisplayName("Should log copied env files and surface failures as an error")
  void envFilesCopied_WithFailure_LogsAndSetsError() {
    final AppState state = apply(AppState.initial(), new Action.OpenProject("/p/a"),
        new Action.AddWorktree("/p/a-fix", "fix"));
    final String fixId = WorktreeState.idFor("/p/a-fix");

    final Transition ok = reducer.reduce(state, new Action.EnvFilesCopied(fixId, List.of(".env"), List.of()));
    final Transition partial = reducer.reduce(state,
        new Action.EnvFilesCopied(fixId, List.of(".env"), List.of(".envrc: Permission denied")));

    assertThat(ok.state().error()).isNull();
    assertThat(ok.effects()).singleElement().isInstanceOfSatisfying(Effect.AppendRecord.class, e -> {
      assertThat(e.scope()).isEqualTo("env");
      assertThat(e.content()).isEqualTo("copied .env to /p/a-fix");
    });
    assertThat(partial.state().error().code()).isEqualTo("env_copy_failed");
    assertThat(partial.state().error().context()).isEqualTo(".envrc: Permission denied");
    assertThat(partial.effects()).hasSize(2);
  }

  @Test
  @DisplayName("Should ignore a copy result for a worktree that was removed")
  void envFilesCopied_RemovedWorktree_Ignored() {
    final AppState state = apply(AppState.initial(), new Action.OpenProject("/p/a"));

    final Transition t = reducer.reduce(state,
        new Action.EnvFilesCopied(WorktreeState.idFor("/p/gone"), List.of(".env"), List.of()));

    assertThat(t.state()).isSameAs(state);
    assertThat(t.effects()).isEmpty();
  }
}
