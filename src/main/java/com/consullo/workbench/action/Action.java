package com.consullo.workbench.action;

import com.consullo.workbench.state.ActiveView;
import com.consullo.workbench.state.ContainerService;
import com.consullo.workbench.state.FileComment;
import com.consullo.workbench.state.FileEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * A request to change state. Every kind is a record nested here and named by {@link ActionType}.
 *
 * <p>Compact constructors reject blank ids and paths and non-positive terminal sizes, so an action that exists is
 * well formed. Actions marked as follow-ups are produced by background work and carry the id of the subtree they
 * were produced for.
 *
 * @since 1.0
 */
public sealed interface Action {

  ActionType type();

  // --- projects, worktrees and global state

  record OpenProject(String path) implements Action {
    public OpenProject {
      Validate.notBlank(path, "path must not be blank");
      Validate.isTrue(Path.of(path).isAbsolute(), "path must be absolute: %s", path);
    }

    @Override
    public ActionType type() {
      return ActionType.OPEN_PROJECT;
    }
  }

  record CloseProject(@JsonProperty(required = true) int index) implements Action {
    public CloseProject {
      Validate.isTrue(index >= 0, "index must not be negative");
    }

    @Override
    public ActionType type() {
      return ActionType.CLOSE_PROJECT;
    }
  }

  record SwitchProject(@JsonProperty(required = true) int index) implements Action {
    public SwitchProject {
      Validate.isTrue(index >= 0, "index must not be negative");
    }

    @Override
    public ActionType type() {
      return ActionType.SWITCH_PROJECT;
    }
  }

  record AddWorktree(String path, String branch) implements Action {
    public AddWorktree {
      Validate.notBlank(path, "path must not be blank");
      Validate.isTrue(Path.of(path).isAbsolute(), "path must be absolute: %s", path);
      Validate.notBlank(branch, "branch must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.ADD_WORKTREE;
    }
  }

  record RemoveWorktree(String worktreeId) implements Action {
    public RemoveWorktree {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.REMOVE_WORKTREE;
    }
  }

  record SwitchWorktree(@JsonProperty(required = true) int index) implements Action {
    public SwitchWorktree {
      Validate.isTrue(index >= 0, "index must not be negative");
    }

    @Override
    public ActionType type() {
      return ActionType.SWITCH_WORKTREE;
    }
  }

  record SetActiveView(ActiveView view) implements Action {
    public SetActiveView {
      Validate.notNull(view, "view must not be null");
    }

    @Override
    public ActionType type() {
      return ActionType.SET_ACTIVE_VIEW;
    }
  }

  record SetContainerServices(@JsonProperty(required = true) boolean available, List<ContainerService> services)
      implements Action {
    public SetContainerServices {
      services = services == null ? List.of() : List.copyOf(services);
    }

    @Override
    public ActionType type() {
      return ActionType.SET_CONTAINER_SERVICES;
    }
  }

  record SetError(String code, String message, String context) implements Action {
    public SetError {
      Validate.notBlank(code, "code must not be blank");
      Validate.notNull(message, "message must not be null");
    }

    @Override
    public ActionType type() {
      return ActionType.SET_ERROR;
    }
  }

  record ClearError() implements Action {
    @Override
    public ActionType type() {
      return ActionType.CLEAR_ERROR;
    }
  }

  // --- environment file sync (active project)

  record SetEnvTrackedPatterns(List<String> patterns) implements Action {
    public SetEnvTrackedPatterns {
      Validate.notNull(patterns, "patterns must not be null");
      patterns = List.copyOf(patterns);
      for (final String pattern : patterns) {
        Validate.notBlank(pattern, "patterns must not contain blank entries");
        final Path relative = Path.of(pattern).normalize();
        Validate.isTrue(!relative.isAbsolute() && !relative.startsWith(".."),
            "pattern must stay inside the worktree: %s", pattern);
      }
    }

    @Override
    public ActionType type() {
      return ActionType.SET_ENV_TRACKED_PATTERNS;
    }
  }

  record SetEnvAutoCopy(@JsonProperty(required = true) boolean enabled) implements Action {
    @Override
    public ActionType type() {
      return ActionType.SET_ENV_AUTO_COPY;
    }
  }

  record SetEnvSourceWorktree(String path) implements Action {
    public SetEnvSourceWorktree {
      Validate.notBlank(path, "path must not be blank");
      Validate.isTrue(Path.of(path).isAbsolute(), "path must be absolute: %s", path);
    }

    @Override
    public ActionType type() {
      return ActionType.SET_ENV_SOURCE_WORKTREE;
    }
  }

  /** Copies the tracked files from the project's source worktree into {@code worktreeId}. */
  record CopyEnvFiles(String worktreeId) implements Action {
    public CopyEnvFiles {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.COPY_ENV_FILES;
    }
  }

  /**
   * Follow-up of an env file copy.
   *
   * @param worktreeId worktree the files were copied into
   * @param copied patterns copied
   * @param failed {@code pattern: reason} for every pattern that could not be copied
   */
  record EnvFilesCopied(String worktreeId, List<String> copied, List<String> failed) implements Action {
    public EnvFilesCopied {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      copied = copied == null ? List.of() : List.copyOf(copied);
      failed = failed == null ? List.of() : List.copyOf(failed);
    }

    @Override
    public ActionType type() {
      return ActionType.ENV_FILES_COPIED;
    }
  }

  // --- explorer

  record ExploreDir(String path) implements Action {
    public ExploreDir {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.EXPLORE_DIR;
    }
  }

  record ExpandDirectory(String path) implements Action {
    public ExpandDirectory {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.EXPAND_DIRECTORY;
    }
  }

  record CollapseDirectory(String path) implements Action {
    public CollapseDirectory {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.COLLAPSE_DIRECTORY;
    }
  }

  record RefreshDirectory(String path) implements Action {
    public RefreshDirectory {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.REFRESH_DIRECTORY;
    }
  }

  /** Follow-up: a directory read finished. */
  record SetDirectoryCache(String worktreeId, String path, List<FileEntry> entries) implements Action {
    public SetDirectoryCache {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(path, "path must not be blank");
      entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public ActionType type() {
      return ActionType.SET_DIRECTORY_CACHE;
    }
  }

  /** Follow-up: a directory read failed. */
  record DirectoryLoadFailed(String worktreeId, String path, String message) implements Action {
    public DirectoryLoadFailed {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(path, "path must not be blank");
      message = message == null ? "" : message;
    }

    @Override
    public ActionType type() {
      return ActionType.DIRECTORY_LOAD_FAILED;
    }
  }

  record OpenFile(String path) implements Action {
    public OpenFile {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.OPEN_FILE;
    }
  }

  record PinTab(String path) implements Action {
    public PinTab {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.PIN_TAB;
    }
  }

  record CloseTab(String path) implements Action {
    public CloseTab {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.CLOSE_TAB;
    }
  }

  record SwitchTab(String path) implements Action {
    public SwitchTab {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.SWITCH_TAB;
    }
  }

  record SetTabScroll(String path, @JsonProperty(required = true) int position) implements Action {
    public SetTabScroll {
      Validate.notBlank(path, "path must not be blank");
      Validate.isTrue(position >= 0, "position must not be negative");
    }

    @Override
    public ActionType type() {
      return ActionType.SET_TAB_SCROLL;
    }
  }

  record SelectFile(String path) implements Action {
    public SelectFile {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.SELECT_FILE;
    }
  }

  /** Follow-up: comments of a selected file were read. */
  record SetFileComments(String worktreeId, String path, List<FileComment> comments) implements Action {
    public SetFileComments {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(path, "path must not be blank");
      comments = comments == null ? List.of() : List.copyOf(comments);
    }

    @Override
    public ActionType type() {
      return ActionType.SET_FILE_COMMENTS;
    }
  }

  record AddFileComment(String path, String content) implements Action {
    public AddFileComment {
      Validate.notBlank(path, "path must not be blank");
      Validate.notBlank(content, "content must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.ADD_FILE_COMMENT;
    }
  }

  record DeleteFileComment(String path, @JsonProperty(required = true) long commentId) implements Action {
    public DeleteFileComment {
      Validate.notBlank(path, "path must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.DELETE_FILE_COMMENT;
    }
  }

  // --- terminal

  record SpawnTerminal(String worktreeId, @JsonProperty(required = true) int cols,
      @JsonProperty(required = true) int rows) implements Action {
    public SpawnTerminal {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.isTrue(cols > 0, "cols must be positive");
      Validate.isTrue(rows > 0, "rows must be positive");
    }

    @Override
    public ActionType type() {
      return ActionType.SPAWN_TERMINAL;
    }
  }

  /** Follow-up: the registry started a session for a spawning terminal. */
  record TerminalSpawned(String worktreeId, String sessionId) implements Action {
    public TerminalSpawned {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(sessionId, "sessionId must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.TERMINAL_SPAWNED;
    }
  }

  /** Follow-up: the registry could not start a session. */
  record TerminalSpawnFailed(String worktreeId, String message) implements Action {
    public TerminalSpawnFailed {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      message = message == null ? "spawn failed" : message;
    }

    @Override
    public ActionType type() {
      return ActionType.TERMINAL_SPAWN_FAILED;
    }
  }

  record ResizeTerminal(String sessionId, @JsonProperty(required = true) int cols,
      @JsonProperty(required = true) int rows) implements Action {
    public ResizeTerminal {
      Validate.notBlank(sessionId, "sessionId must not be blank");
      Validate.isTrue(cols > 0, "cols must be positive");
      Validate.isTrue(rows > 0, "rows must be positive");
    }

    @Override
    public ActionType type() {
      return ActionType.RESIZE_TERMINAL;
    }
  }

  record WriteTerminal(String sessionId, String data) implements Action {
    public WriteTerminal {
      Validate.notBlank(sessionId, "sessionId must not be blank");
      Validate.notNull(data, "data must not be null");
    }

    @Override
    public ActionType type() {
      return ActionType.WRITE_TERMINAL;
    }
  }

  record KillTerminal(String sessionId) implements Action {
    public KillTerminal {
      Validate.notBlank(sessionId, "sessionId must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.KILL_TERMINAL;
    }
  }

  /** Follow-up: a chunk of decoded session output. */
  record TerminalOutput(String sessionId, String data) implements Action {
    public TerminalOutput {
      Validate.notBlank(sessionId, "sessionId must not be blank");
      Validate.notNull(data, "data must not be null");
    }

    @Override
    public ActionType type() {
      return ActionType.TERMINAL_OUTPUT;
    }
  }

  /** Follow-up: the session's process ended. */
  record TerminalExited(String sessionId, Integer exitCode) implements Action {
    public TerminalExited {
      Validate.notBlank(sessionId, "sessionId must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.TERMINAL_EXITED;
    }
  }

  // --- chat

  record SubmitChatMessage(String text) implements Action {
    public SubmitChatMessage {
      Validate.notBlank(text, "text must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.SUBMIT_CHAT_MESSAGE;
    }
  }

  /** Follow-up: a streamed delta for an in-flight assistant message. */
  record UpdateChatMessage(String worktreeId, String messageId, String delta) implements Action {
    public UpdateChatMessage {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(messageId, "messageId must not be blank");
      Validate.notNull(delta, "delta must not be null");
    }

    @Override
    public ActionType type() {
      return ActionType.UPDATE_CHAT_MESSAGE;
    }
  }

  /** Follow-up: the stream for a message finished. */
  record CompleteChatMessage(String worktreeId, String messageId) implements Action {
    public CompleteChatMessage {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(messageId, "messageId must not be blank");
    }

    @Override
    public ActionType type() {
      return ActionType.COMPLETE_CHAT_MESSAGE;
    }
  }

  /** Follow-up: the stream for a message failed. */
  record FailChatMessage(String worktreeId, String messageId, String error) implements Action {
    public FailChatMessage {
      Validate.notBlank(worktreeId, "worktreeId must not be blank");
      Validate.notBlank(messageId, "messageId must not be blank");
      error = error == null ? "completion failed" : error;
    }

    @Override
    public ActionType type() {
      return ActionType.FAIL_CHAT_MESSAGE;
    }
  }

  record ClearChat() implements Action {
    @Override
    public ActionType type() {
      return ActionType.CLEAR_CHAT;
    }
  }
}
