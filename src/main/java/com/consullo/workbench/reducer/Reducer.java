package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.config.WorkbenchConfig;
import com.consullo.workbench.state.AppState;
import org.apache.commons.lang3.Validate;

/**
 * The transition function of the store.
 *
 * <p>{@link #reduce(AppState, Action)} is pure: it reads no clock, draws no random numbers and performs no I/O, so
 * the same state and action always give the same {@link Transition}. Everything that touches the outside world is
 * returned as an {@link Effect}.
 *
 * @since 1.0
 */
public final class Reducer {

  private final ProjectReducer projects;
  private final ExplorerReducer explorer;
  private final TerminalReducer terminals;
  private final ChatReducer chat;

  /**
   * Creates a reducer.
   *
   * @param maxRecentProjects recent project list cap
   * @param terminalOutputChars terminal output tail size
   * @param maxChatMessages chat history cap
   */
  public Reducer(final int maxRecentProjects, final int terminalOutputChars, final int maxChatMessages) {
    Validate.isTrue(maxRecentProjects > 0, "maxRecentProjects must be positive");
    Validate.isTrue(terminalOutputChars > 0, "terminalOutputChars must be positive");
    Validate.isTrue(maxChatMessages > 0, "maxChatMessages must be positive");
    this.projects = new ProjectReducer(maxRecentProjects);
    this.explorer = new ExplorerReducer();
    this.terminals = new TerminalReducer(terminalOutputChars);
    this.chat = new ChatReducer(maxChatMessages);
  }

  public static Reducer forConfig(final WorkbenchConfig config) {
    return new Reducer(config.maxRecentProjects(), config.terminalOutputChars(), config.maxChatMessages());
  }

  public Transition reduce(final AppState state, final Action action) {
    Validate.notNull(state, "state must not be null");
    Validate.notNull(action, "action must not be null");

    return switch (action.type()) {
      case OPEN_PROJECT -> projects.openProject(state, (Action.OpenProject) action);
      case CLOSE_PROJECT -> projects.closeProject(state, (Action.CloseProject) action);
      case SWITCH_PROJECT -> projects.switchProject(state, (Action.SwitchProject) action);
      case ADD_WORKTREE -> projects.addWorktree(state, (Action.AddWorktree) action);
      case REMOVE_WORKTREE -> projects.removeWorktree(state, (Action.RemoveWorktree) action);
      case SWITCH_WORKTREE -> projects.switchWorktree(state, (Action.SwitchWorktree) action);
      case SET_ACTIVE_VIEW -> projects.setActiveView(state, (Action.SetActiveView) action);
      case SET_CONTAINER_SERVICES -> projects.setContainerServices(state, (Action.SetContainerServices) action);
      case SET_ERROR -> projects.setError(state, (Action.SetError) action);
      case CLEAR_ERROR -> projects.clearError(state);
      case SET_ENV_TRACKED_PATTERNS -> projects.setEnvTrackedPatterns(state, (Action.SetEnvTrackedPatterns) action);
      case SET_ENV_AUTO_COPY -> projects.setEnvAutoCopy(state, (Action.SetEnvAutoCopy) action);
      case SET_ENV_SOURCE_WORKTREE -> projects.setEnvSourceWorktree(state, (Action.SetEnvSourceWorktree) action);
      case COPY_ENV_FILES -> projects.copyEnvFiles(state, (Action.CopyEnvFiles) action);
      case ENV_FILES_COPIED -> projects.envFilesCopied(state, (Action.EnvFilesCopied) action);

      case EXPLORE_DIR -> explorer.exploreDir(state, (Action.ExploreDir) action);
      case EXPAND_DIRECTORY -> explorer.expandDirectory(state, (Action.ExpandDirectory) action);
      case COLLAPSE_DIRECTORY -> explorer.collapseDirectory(state, (Action.CollapseDirectory) action);
      case REFRESH_DIRECTORY -> explorer.refreshDirectory(state, (Action.RefreshDirectory) action);
      case SET_DIRECTORY_CACHE -> explorer.setDirectoryCache(state, (Action.SetDirectoryCache) action);
      case DIRECTORY_LOAD_FAILED -> explorer.directoryLoadFailed(state, (Action.DirectoryLoadFailed) action);
      case OPEN_FILE -> explorer.openFile(state, (Action.OpenFile) action);
      case PIN_TAB -> explorer.pinTab(state, (Action.PinTab) action);
      case CLOSE_TAB -> explorer.closeTab(state, (Action.CloseTab) action);
      case SWITCH_TAB -> explorer.switchTab(state, (Action.SwitchTab) action);
      case SET_TAB_SCROLL -> explorer.setTabScroll(state, (Action.SetTabScroll) action);
      case SELECT_FILE -> explorer.selectFile(state, (Action.SelectFile) action);
      case SET_FILE_COMMENTS -> explorer.setFileComments(state, (Action.SetFileComments) action);
      case ADD_FILE_COMMENT -> explorer.addFileComment(state, (Action.AddFileComment) action);
      case DELETE_FILE_COMMENT -> explorer.deleteFileComment(state, (Action.DeleteFileComment) action);

      case SPAWN_TERMINAL -> terminals.spawn(state, (Action.SpawnTerminal) action);
      case TERMINAL_SPAWNED -> terminals.spawned(state, (Action.TerminalSpawned) action);
      case TERMINAL_SPAWN_FAILED -> terminals.spawnFailed(state, (Action.TerminalSpawnFailed) action);
      case RESIZE_TERMINAL -> terminals.resize(state, (Action.ResizeTerminal) action);
      case WRITE_TERMINAL -> terminals.write(state, (Action.WriteTerminal) action);
      case KILL_TERMINAL -> terminals.kill(state, (Action.KillTerminal) action);
      case TERMINAL_OUTPUT -> terminals.output(state, (Action.TerminalOutput) action);
      case TERMINAL_EXITED -> terminals.exited(state, (Action.TerminalExited) action);

      case SUBMIT_CHAT_MESSAGE -> chat.submit(state, (Action.SubmitChatMessage) action);
      case UPDATE_CHAT_MESSAGE -> chat.update(state, (Action.UpdateChatMessage) action);
      case COMPLETE_CHAT_MESSAGE -> chat.complete(state, (Action.CompleteChatMessage) action);
      case FAIL_CHAT_MESSAGE -> chat.fail(state, (Action.FailChatMessage) action);
      case CLEAR_CHAT -> chat.clear(state);
    };
  }
}
