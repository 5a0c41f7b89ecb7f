package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.Validate;

/**
 * A chat message.
 *
 * @param id message id, unique within its chat
 * @param role author
 * @param content text (markdown)
 * @param status streaming status
 * @param error failure message when {@code status} is {@link MessageStatus#ERROR}
 */
public record ChatMessage(String id, ChatRole role, String content, MessageStatus status, String error) {

  public ChatMessage {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(role, "role must not be null");
    Validate.notNull(status, "status must not be null");
    content = content == null ? "" : content;
  }

  @JsonIgnore
  public boolean isStreaming() {
    return status == MessageStatus.STREAMING;
  }

  public ChatMessage append(final String delta) {
    Validate.validState(isStreaming(), "message %s is final", id);
    return new ChatMessage(id, role, content + delta, status, null);
  }

  public ChatMessage complete() {
    Validate.validState(isStreaming(), "message %s is final", id);
    return new ChatMessage(id, role, content, MessageStatus.COMPLETE, null);
  }

  public ChatMessage fail(final String message) {
    Validate.validState(isStreaming(), "message %s is final", id);
    return new ChatMessage(id, role, content, MessageStatus.ERROR, message);
  }
}
