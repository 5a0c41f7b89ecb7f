package com.consullo.workbench.reducer;

import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.ChatMessage;
import com.consullo.workbench.state.ProjectKey;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Side effect requested by a transition, executed by the store after the new state is committed.
 *
 * <p>Foreground effects run on the mutation thread before the action is acknowledged. Background effects are handed
 * to the effect scheduler and report back through follow-up actions.
 *
 * @since 1.0
 */
public sealed interface Effect {

  boolean background();

  /** Appends a durable record. */
  record AppendRecord(RecordKind kind, ProjectKey projectKey, String scope, String content) implements Effect {
    public AppendRecord {
      Validate.notNull(kind, "kind must not be null");
      Validate.notNull(projectKey, "projectKey must not be null");
      Validate.notBlank(scope, "scope must not be blank");
      Validate.notNull(content, "content must not be null");
    }

    @Override
    public boolean background() {
      return false;
    }
  }

  /** Deletes a durable record inside one project's partition. */
  record DeleteRecord(RecordKind kind, ProjectKey projectKey, long id) implements Effect {
    public DeleteRecord {
      Validate.notNull(kind, "kind must not be null");
      Validate.notNull(projectKey, "projectKey must not be null");
    }

    @Override
    public boolean background() {
      return false;
    }
  }

  record LoadDirectory(String worktreeId, String path) implements Effect {
    @Override
    public boolean background() {
      return true;
    }
  }

  record LoadComments(String worktreeId, ProjectKey projectKey, String path) implements Effect {
    @Override
    public boolean background() {
      return true;
    }
  }

  record SpawnSession(String worktreeId, String cwd, int cols, int rows) implements Effect {
    @Override
    public boolean background() {
      return true;
    }
  }

  record KillSession(String sessionId) implements Effect {
    @Override
    public boolean background() {
      return false;
    }
  }

  record KillWorktreeSessions(String worktreeId) implements Effect {
    @Override
    public boolean background() {
      return false;
    }
  }

  record WriteSession(String sessionId, String data) implements Effect {
    @Override
    public boolean background() {
      return false;
    }
  }

  record ResizeSession(String sessionId, int cols, int rows) implements Effect {
    @Override
    public boolean background() {
      return false;
    }
  }

  /**
   * Streams a completion into the assistant message {@code messageId}.
   *
   * @param worktreeId worktree owning the chat
   * @param messageId assistant message receiving the deltas
   * @param cwd directory the backend runs in
   * @param prompt submitted text
   * @param history messages before the submitted one
   */
  record StartCompletion(String worktreeId, String messageId, String cwd, String prompt, List<ChatMessage> history)
      implements Effect {
    public StartCompletion {
      history = List.copyOf(history);
    }

    @Override
    public boolean background() {
      return true;
    }
  }

  /**
   * Copies tracked env files between worktrees. Existing files in {@code to} are left alone.
   *
   * @param worktreeId worktree receiving the files
   * @param from source worktree directory
   * @param to target worktree directory
   * @param patterns tracked patterns, relative to both directories
   */
  record CopyEnvFiles(String worktreeId, String from, String to, List<String> patterns) implements Effect {
    public CopyEnvFiles {
      patterns = List.copyOf(patterns);
    }

    @Override
    public boolean background() {
      return true;
    }
  }

  record CancelCompletion(String worktreeId) implements Effect {
    @Override
    public boolean background() {
      return false;
    }
  }
}
