package com.consullo.workbench.state;

import org.apache.commons.lang3.Validate;

/**
 * Serializable part of a worktree terminal.
 *
 * <p>The process handle itself lives in the session registry and is addressed by {@code sessionId}; this record
 * never holds it.
 *
 * @param sessionId live session id, or {@code null} when no session exists
 * @param cols terminal columns
 * @param rows terminal rows
 * @param status lifecycle status
 * @param error spawn failure message when {@code status} is {@link TerminalStatus#ERROR}
 * @param exitCode exit code of the last session, or {@code null}
 * @param output bounded tail of decoded session output
 * @since 1.0
 */
public record TerminalState(
    String sessionId,
    int cols,
    int rows,
    TerminalStatus status,
    String error,
    Integer exitCode,
    String output) {

  public static final int DEFAULT_COLS = 80;
  public static final int DEFAULT_ROWS = 24;

  public static final TerminalState INITIAL =
      new TerminalState(null, DEFAULT_COLS, DEFAULT_ROWS, TerminalStatus.IDLE, null, null, "");

  public TerminalState {
    Validate.isTrue(cols > 0, "cols must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    status = status == null ? TerminalStatus.IDLE : status;
    output = output == null ? "" : output;
  }

  public boolean hasSession() {
    return sessionId != null;
  }

  public TerminalState spawning(final int newCols, final int newRows) {
    return new TerminalState(null, newCols, newRows, TerminalStatus.SPAWNING, null, null, output);
  }

  public TerminalState running(final String id) {
    return new TerminalState(id, cols, rows, TerminalStatus.RUNNING, null, null, "");
  }

  public TerminalState failed(final String message) {
    return new TerminalState(null, cols, rows, TerminalStatus.ERROR, message, null, output);
  }

  public TerminalState exited(final Integer code) {
    return new TerminalState(null, cols, rows, TerminalStatus.IDLE, null, code, output);
  }

  public TerminalState resized(final int newCols, final int newRows) {
    return new TerminalState(sessionId, newCols, newRows, status, error, exitCode, output);
  }

  /**
   * Appends output, keeping only the last {@code maxChars} characters.
   *
   * @param data decoded output
   * @param maxChars tail size
   * @return updated state
   */
  public TerminalState appendOutput(final String data, final int maxChars) {
    final String joined = output + data;
    String tail = joined;
    if (joined.length() > maxChars) {
      int cut = joined.length() - maxChars;
      if (Character.isLowSurrogate(joined.charAt(cut))) {
        cut++;
      }
      tail = joined.substring(cut);
    }
    return new TerminalState(sessionId, cols, rows, status, error, exitCode, tail);
  }
}
