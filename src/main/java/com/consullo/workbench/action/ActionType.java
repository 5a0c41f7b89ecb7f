package com.consullo.workbench.action;

import java.util.HashMap;
import java.util.Map;

/**
 * Discriminator of the action envelope: wire name plus the payload record it decodes to.
 *
 * @since 1.0
 */
public enum ActionType {
  OPEN_PROJECT("OpenProject", Action.OpenProject.class),
  CLOSE_PROJECT("CloseProject", Action.CloseProject.class),
  SWITCH_PROJECT("SwitchProject", Action.SwitchProject.class),
  ADD_WORKTREE("AddWorktree", Action.AddWorktree.class),
  REMOVE_WORKTREE("RemoveWorktree", Action.RemoveWorktree.class),
  SWITCH_WORKTREE("SwitchWorktree", Action.SwitchWorktree.class),
  SET_ACTIVE_VIEW("SetActiveView", Action.SetActiveView.class),
  SET_CONTAINER_SERVICES("SetContainerServices", Action.SetContainerServices.class),
  SET_ERROR("SetError", Action.SetError.class),
  CLEAR_ERROR("ClearError", Action.ClearError.class),
  SET_ENV_TRACKED_PATTERNS("SetEnvTrackedPatterns", Action.SetEnvTrackedPatterns.class),
  SET_ENV_AUTO_COPY("SetEnvAutoCopy", Action.SetEnvAutoCopy.class),
  SET_ENV_SOURCE_WORKTREE("SetEnvSourceWorktree", Action.SetEnvSourceWorktree.class),
  COPY_ENV_FILES("CopyEnvFiles", Action.CopyEnvFiles.class),
  ENV_FILES_COPIED("EnvFilesCopied", Action.EnvFilesCopied.class),
  EXPLORE_DIR("ExploreDir", Action.ExploreDir.class),
  EXPAND_DIRECTORY("ExpandDirectory", Action.ExpandDirectory.class),
  COLLAPSE_DIRECTORY("CollapseDirectory", Action.CollapseDirectory.class),
  REFRESH_DIRECTORY("RefreshDirectory", Action.RefreshDirectory.class),
  SET_DIRECTORY_CACHE("SetDirectoryCache", Action.SetDirectoryCache.class),
  DIRECTORY_LOAD_FAILED("DirectoryLoadFailed", Action.DirectoryLoadFailed.class),
  OPEN_FILE("OpenFile", Action.OpenFile.class),
  PIN_TAB("PinTab", Action.PinTab.class),
  CLOSE_TAB("CloseTab", Action.CloseTab.class),
  SWITCH_TAB("SwitchTab", Action.SwitchTab.class),
  SET_TAB_SCROLL("SetTabScroll", Action.SetTabScroll.class),
  SELECT_FILE("SelectFile", Action.SelectFile.class),
  SET_FILE_COMMENTS("SetFileComments", Action.SetFileComments.class),
  ADD_FILE_COMMENT("AddFileComment", Action.AddFileComment.class),
  DELETE_FILE_COMMENT("DeleteFileComment", Action.DeleteFileComment.class),
  SPAWN_TERMINAL("SpawnTerminal", Action.SpawnTerminal.class),
  TERMINAL_SPAWNED("TerminalSpawned", Action.TerminalSpawned.class),
  TERMINAL_SPAWN_FAILED("TerminalSpawnFailed", Action.TerminalSpawnFailed.class),
  RESIZE_TERMINAL("ResizeTerminal", Action.ResizeTerminal.class),
  WRITE_TERMINAL("WriteTerminal", Action.WriteTerminal.class),
  KILL_TERMINAL("KillTerminal", Action.KillTerminal.class),
  TERMINAL_OUTPUT("TerminalOutput", Action.TerminalOutput.class),
  TERMINAL_EXITED("TerminalExited", Action.TerminalExited.class),
  SUBMIT_CHAT_MESSAGE("SubmitChatMessage", Action.SubmitChatMessage.class),
  UPDATE_CHAT_MESSAGE("UpdateChatMessage", Action.UpdateChatMessage.class),
  COMPLETE_CHAT_MESSAGE("CompleteChatMessage", Action.CompleteChatMessage.class),
  FAIL_CHAT_MESSAGE("FailChatMessage", Action.FailChatMessage.class),
  CLEAR_CHAT("ClearChat", Action.ClearChat.class);

  private static final Map<String, ActionType> BY_WIRE_NAME = new HashMap<>(64);

  static {
    for (final ActionType t : values()) {
      BY_WIRE_NAME.put(t.wireName, t);
    }
  }

  private final String wireName;
  private final Class<? extends Action> payloadClass;

  ActionType(final String wireName, final Class<? extends Action> payloadClass) {
    this.wireName = wireName;
    this.payloadClass = payloadClass;
  }

  public String wireName() {
    return wireName;
  }

  public Class<? extends Action> payloadClass() {
    return payloadClass;
  }

  /**
   * Looks up a type by its wire name.
   *
   * @param wireName envelope {@code type}
   * @return the type, or {@code null} when unknown
   */
  public static ActionType fromWireName(final String wireName) {
    return wireName == null ? null : BY_WIRE_NAME.get(wireName);
  }
}
