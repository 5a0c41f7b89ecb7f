package com.consullo.workbench.store;

/**
 * The action is unknown or its payload is malformed. State is left untouched.
 *
 * @since 1.0
 */
public class InvalidActionException extends DispatchException {

  private static final long serialVersionUID = 1L;

  public InvalidActionException(final String message) {
    super(message);
  }

  public InvalidActionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
