package com.consullo.workbench.effects;

/**
 * A completion stream could not be started or ended in an error.
 *
 * @since 1.0
 */
public class CompletionFailureException extends Exception {

  private static final long serialVersionUID = 1L;

  public CompletionFailureException(final String message) {
    super(message);
  }

  public CompletionFailureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
