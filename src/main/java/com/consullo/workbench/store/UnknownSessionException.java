package com.consullo.workbench.store;

/**
 * An operation addressed a terminal session id that has no live registry entry.
 *
 * @since 1.0
 */
public class UnknownSessionException extends DispatchException {

  private static final long serialVersionUID = 1L;

  private final String sessionId;

  public UnknownSessionException(final String sessionId) {
    super("Unknown terminal session: " + sessionId);
    this.sessionId = sessionId;
  }

  public String sessionId() {
    return sessionId;
  }
}
