package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Author of a chat message.
 */
public enum ChatRole {
  @JsonProperty("user") USER,
  @JsonProperty("assistant") ASSISTANT,
  @JsonProperty("system") SYSTEM
}
