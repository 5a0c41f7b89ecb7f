package com.consullo.workbench.pty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal controller for a PTY-attached subprocess.
 *
 * <p>Implementations must provide:
 * - the PTY output stream, read by exactly one pump
 * - the PTY input stream for keystrokes
 * - resize support
 * - exit monitoring
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  InputStream output();

  OutputStream input();

  void resize(int columns, int rows) throws IOException;

  CompletableFuture<Integer> onExit();

  long pid();

  boolean isAlive();

  /**
   * Terminates the process and releases the PTY. Calling it again has no effect.
   */
  @Override
  void close();
}
