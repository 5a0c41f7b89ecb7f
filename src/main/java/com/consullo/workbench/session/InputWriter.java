package com.consullo.workbench.session;

import com.consullo.workbench.pty.PtyProcessController;
import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds one session's PTY input from its own thread.
 *
 * <p>A child that stops reading stdin fills the tty input buffer and blocks the writer, never the caller. Chunks are
 * written in submission order. Once {@code maxPending} chunks are waiting, {@link #enqueue} refuses more.
 *
 * @since 1.0
 */
final class InputWriter implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(InputWriter.class);

  private final String sessionId;
  private final PtyProcessController controller;
  private final BlockingQueue<byte[]> pending;

  private volatile boolean cancelled;
  private volatile Thread thread;

  InputWriter(final String sessionId, final PtyProcessController controller, final int maxPending) {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(controller, "controller must not be null");
    Validate.isTrue(maxPending > 0, "maxPending must be positive");
    this.sessionId = sessionId;
    this.controller = controller;
    this.pending = new LinkedBlockingQueue<>(maxPending);
  }

  void start() {
    final Thread t = new Thread(this, "pty-writer-" + sessionId);
    t.setDaemon(true);
    this.thread = t;
    t.start();
  }

  /**
   * Queues bytes for the child without waiting for them to be written.
   *
   * @throws IOException if the writer was cancelled or too much input is already waiting
   */
  void enqueue(final byte[] bytes) throws IOException {
    if (cancelled) {
      throw new IOException("Session " + sessionId + " is closed");
    }
    if (!pending.offer(bytes)) {
      throw new IOException("Session " + sessionId + " is not reading its input; " + pending.size()
          + " writes pending");
    }
  }

  int pendingWrites() {
    return pending.size();
  }

  void cancel() {
    cancelled = true;
    pending.clear();
    final Thread t = thread;
    if (t != null && t != Thread.currentThread()) {
      t.interrupt();
    }
  }

  @Override
  public void run() {
    final OutputStream in = controller.input();
    try {
      while (!cancelled) {
        final byte[] bytes = pending.take();
        in.write(bytes);
        in.flush();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Session {} writer interrupted", sessionId);
    } catch (final IOException e) {
      if (!cancelled) {
        LOGGER.warn("Session {} input closed: {}", sessionId, e.getMessage());
      }
      cancelled = true;
      pending.clear();
    }
  }
}
