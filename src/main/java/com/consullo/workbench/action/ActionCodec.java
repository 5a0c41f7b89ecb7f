package com.consullo.workbench.action;

import com.consullo.workbench.state.StateJson;
import com.consullo.workbench.store.InvalidActionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.Validate;

/**
 * Reads and writes the {@code {"type": ..., "payload": {...}}} action envelope.
 *
 * <p>Anything that does not decode to a well formed action, including an unknown {@code type}, a missing required
 * field, a field of the wrong JSON type or a value rejected by the action's constructor, raises
 * {@link InvalidActionException}. A missing {@code payload} is read as an empty object.
 *
 * @since 1.0
 */
public final class ActionCodec {

  private final ObjectMapper mapper;

  public ActionCodec() {
    this(StateJson.mapper());
  }

  public ActionCodec(final ObjectMapper mapper) {
    Validate.notNull(mapper, "mapper must not be null");
    this.mapper = mapper;
  }

  public Action decode(final String json) throws InvalidActionException {
    if (json == null) {
      throw new InvalidActionException("action envelope must not be null");
    }
    final JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new InvalidActionException("action envelope is not valid JSON: " + e.getOriginalMessage(), e);
    }
    return decode(root);
  }

  public Action decode(final JsonNode envelope) throws InvalidActionException {
    if (envelope == null || !envelope.isObject()) {
      throw new InvalidActionException("action envelope must be a JSON object");
    }
    final JsonNode typeNode = envelope.get("type");
    if (typeNode == null || !typeNode.isTextual()) {
      throw new InvalidActionException("action envelope has no string 'type'");
    }
    final ActionType type = ActionType.fromWireName(typeNode.asText());
    if (type == null) {
      throw new InvalidActionException("unknown action type: " + typeNode.asText());
    }

    JsonNode payload = envelope.get("payload");
    if (payload == null || payload.isNull()) {
      payload = mapper.createObjectNode();
    }
    if (!payload.isObject()) {
      throw new InvalidActionException(type.wireName() + " payload must be a JSON object");
    }

    try {
      return mapper.treeToValue(payload, type.payloadClass());
    } catch (final JsonProcessingException e) {
      throw new InvalidActionException("malformed " + type.wireName() + " payload: " + rootMessage(e), e);
    } catch (final IllegalArgumentException | NullPointerException e) {
      throw new InvalidActionException("malformed " + type.wireName() + " payload: " + e.getMessage(), e);
    }
  }

  public ObjectNode encodeTree(final Action action) {
    Validate.notNull(action, "action must not be null");
    final ObjectNode envelope = mapper.createObjectNode();
    envelope.put("type", action.type().wireName());
    envelope.set("payload", mapper.valueToTree(action));
    return envelope;
  }

  public String encode(final Action action) {
    try {
      return mapper.writeValueAsString(encodeTree(action));
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode " + action.type().wireName(), e);
    }
  }

  private static String rootMessage(final JsonProcessingException e) {
    Throwable t = e;
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t == e ? e.getOriginalMessage() : t.getMessage();
  }
}
