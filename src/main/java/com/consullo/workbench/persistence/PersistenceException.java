package com.consullo.workbench.persistence;

/**
 * A durable read or write failed.
 *
 * @since 1.0
 */
public class PersistenceException extends Exception {

  private static final long serialVersionUID = 1L;

  public PersistenceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
