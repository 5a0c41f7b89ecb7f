package com.consullo.workbench.effects;

import com.consullo.workbench.state.ChatMessage;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Input of one completion.
 *
 * @param worktreeId worktree owning the chat
 * @param messageId assistant message being streamed
 * @param cwd directory the backend runs in
 * @param prompt submitted text
 * @param history earlier messages, oldest first
 */
public record CompletionRequest(String worktreeId, String messageId, Path cwd, String prompt,
    List<ChatMessage> history) {

  public CompletionRequest {
    Validate.notBlank(worktreeId, "worktreeId must not be blank");
    Validate.notBlank(messageId, "messageId must not be blank");
    Validate.notNull(cwd, "cwd must not be null");
    Validate.notBlank(prompt, "prompt must not be blank");
    history = history == null ? List.of() : List.copyOf(history);
  }
}
