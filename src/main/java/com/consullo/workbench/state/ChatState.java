package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.Validate;

/**
 * Worktree-scoped chat history.
 *
 * @param messages messages in order, oldest first
 * @param nextSeq sequence used for the next message id
 * @param error last chat-level error, or {@code null}
 * @since 1.0
 */
public record ChatState(List<ChatMessage> messages, long nextSeq, String error) {

  public static final ChatState EMPTY = new ChatState(List.of(), 1L, null);

  public ChatState {
    messages = messages == null ? List.of() : List.copyOf(messages);
    Validate.isTrue(nextSeq > 0, "nextSeq must be positive");
  }

  @JsonIgnore
  public boolean isStreaming() {
    return messages.stream().anyMatch(ChatMessage::isStreaming);
  }

  public ChatMessage message(final String id) {
    for (final ChatMessage m : messages) {
      if (m.id().equals(id)) {
        return m;
      }
    }
    return null;
  }

  /**
   * Appends messages, dropping the oldest ones beyond {@code maxMessages}.
   *
   * @param added messages to append
   * @param maxMessages cap
   * @return updated chat
   */
  public ChatState append(final List<ChatMessage> added, final int maxMessages) {
    final List<ChatMessage> next = new ArrayList<>(messages.size() + added.size());
    next.addAll(messages);
    next.addAll(added);
    final List<ChatMessage> kept = next.size() > maxMessages ? next.subList(next.size() - maxMessages, next.size()) : next;
    return new ChatState(kept, nextSeq + added.size(), null);
  }

  public ChatState updateMessage(final String id, final UnaryOperator<ChatMessage> update) {
    final List<ChatMessage> next = new ArrayList<>(messages.size());
    for (final ChatMessage m : messages) {
      next.add(m.id().equals(id) ? update.apply(m) : m);
    }
    return new ChatState(next, nextSeq, error);
  }

  public ChatState withError(final String message) {
    return new ChatState(messages, nextSeq, message);
  }

  public ChatState cleared() {
    return new ChatState(List.of(), nextSeq, null);
  }
}
