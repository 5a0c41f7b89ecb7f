package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Streaming status of a chat message. Only {@link #STREAMING} messages change; the others are final.
 */
public enum MessageStatus {
  @JsonProperty("streaming") STREAMING,
  @JsonProperty("complete") COMPLETE,
  @JsonProperty("error") ERROR
}
