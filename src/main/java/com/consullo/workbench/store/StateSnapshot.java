package com.consullo.workbench.store;

import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.StateJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.Validate;

/**
 * A committed state and its revision. The JSON form is rendered once and shared by every subscriber.
 *
 * @since 1.0
 */
public final class StateSnapshot {

  private final long revision;
  private final AppState state;
  private volatile String json;

  public StateSnapshot(final long revision, final AppState state) {
    Validate.isTrue(revision >= 0, "revision must not be negative");
    this.revision = revision;
    this.state = Validate.notNull(state, "state must not be null");
  }

  public long revision() {
    return revision;
  }

  public AppState state() {
    return state;
  }

  /**
   * Serialized form {@code {"revision": n, "state": {...}}}.
   *
   * @return JSON text
   */
  public String toJson() {
    String rendered = json;
    if (rendered == null) {
      final ObjectNode node = StateJson.mapper().createObjectNode();
      node.put("revision", revision);
      node.set("state", StateJson.mapper().valueToTree(state));
      try {
        rendered = StateJson.mapper().writeValueAsString(node);
      } catch (final JsonProcessingException e) {
        throw new IllegalStateException("Failed to serialize state revision " + revision, e);
      }
      json = rendered;
    }
    return rendered;
  }

  @Override
  public String toString() {
    return "StateSnapshot{revision=" + revision + "}";
  }
}
