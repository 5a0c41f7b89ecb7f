package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a worktree terminal as seen by the state tree.
 */
public enum TerminalStatus {
  /** No session and no spawn outstanding. */
  @JsonProperty("idle") IDLE,
  /** Spawn requested, session id not known yet. */
  @JsonProperty("spawning") SPAWNING,
  /** A live session is registered under {@code sessionId}. */
  @JsonProperty("running") RUNNING,
  /** The last spawn failed; a new spawn may be requested. */
  @JsonProperty("error") ERROR
}
