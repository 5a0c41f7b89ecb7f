package com.consullo.workbench.reducer;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ChatMessage;
import com.consullo.workbench.state.ChatRole;
import com.consullo.workbench.state.ChatState;
import com.consullo.workbench.state.MessageStatus;
import com.consullo.workbench.state.WorktreeState;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Chat transitions.
 *
 * <p>A chat has at most one streaming message. A submission while one streams is rejected: history is left alone
 * and {@link ChatState#error()} explains why.
 */
final class ChatReducer {

  static final String SCOPE = "chat";
  static final String ALREADY_STREAMING = "A response is already streaming";

  private final int maxMessages;

  ChatReducer(final int maxMessages) {
    this.maxMessages = maxMessages;
  }

  static String messageId(final long seq) {
    return "msg-" + seq;
  }

  Transition submit(final AppState state, final Action.SubmitChatMessage action) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final ChatState chat = wt.chat();
    if (chat.isStreaming()) {
      if (ALREADY_STREAMING.equals(chat.error())) {
        return Transition.unchanged(state);
      }
      return Transition.unchanged(state.mapWorktree(wt.id(), w -> w.withChat(chat.withError(ALREADY_STREAMING))));
    }

    final ChatMessage user = new ChatMessage(messageId(chat.nextSeq()), ChatRole.USER, action.text(),
        MessageStatus.COMPLETE, null);
    final ChatMessage reply = new ChatMessage(messageId(chat.nextSeq() + 1), ChatRole.ASSISTANT, "",
        MessageStatus.STREAMING, null);
    final AppState next = state.mapWorktree(wt.id(), w -> w.withChat(chat.append(List.of(user, reply), maxMessages)));
    return Transition.of(next,
        new Effect.StartCompletion(wt.id(), reply.id(), wt.path(), action.text(), chat.messages()));
  }

  Transition update(final AppState state, final Action.UpdateChatMessage action) {
    return onStreaming(state, action.worktreeId(), action.messageId(), m -> m.append(action.delta()));
  }

  Transition complete(final AppState state, final Action.CompleteChatMessage action) {
    return onStreaming(state, action.worktreeId(), action.messageId(), ChatMessage::complete);
  }

  Transition fail(final AppState state, final Action.FailChatMessage action) {
    final Transition failed = onStreaming(state, action.worktreeId(), action.messageId(),
        m -> m.fail(action.error()));
    if (failed.state() == state) {
      return failed;
    }
    return Transition.of(failed.state(), new Effect.AppendRecord(RecordKind.ACTIVITY,
        state.projectOfWorktree(action.worktreeId()).projectKey(), SCOPE,
        "completion " + action.messageId() + " failed: " + action.error()));
  }

  Transition clear(final AppState state) {
    final WorktreeState wt = state.activeWorktree();
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final AppState next = wt.chat().messages().isEmpty() && wt.chat().error() == null
        ? state
        : state.mapWorktree(wt.id(), w -> w.withChat(w.chat().cleared()));
    return Transition.of(next, new Effect.CancelCompletion(wt.id()));
  }

  private static Transition onStreaming(final AppState state, final String worktreeId, final String messageId,
      final UnaryOperator<ChatMessage> update) {
    final WorktreeState wt = state.worktree(worktreeId);
    if (wt == null) {
      return Transition.unchanged(state);
    }
    final ChatMessage message = wt.chat().message(messageId);
    if (message == null || !message.isStreaming()) {
      return Transition.unchanged(state);
    }
    return Transition.unchanged(state.mapWorktree(worktreeId,
        w -> w.withChat(w.chat().updateMessage(messageId, update))));
  }
}
