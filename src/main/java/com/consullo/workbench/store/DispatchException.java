package com.consullo.workbench.store;

/**
 * Raised to a dispatching caller when an action is rejected before it changes any state.
 *
 * @since 1.0
 */
public class DispatchException extends Exception {

  private static final long serialVersionUID = 1L;

  public DispatchException(final String message) {
    super(message);
  }

  public DispatchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
