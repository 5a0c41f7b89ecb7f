package com.consullo.workbench.session;

/**
 * The operating system refused to start a terminal process.
 *
 * @since 1.0
 */
public class SpawnFailureException extends Exception {

  private static final long serialVersionUID = 1L;

  public SpawnFailureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
