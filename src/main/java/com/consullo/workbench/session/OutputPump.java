package com.consullo.workbench.session;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.action.ActionSink;
import com.consullo.workbench.pty.PtyProcessController;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one session's PTY output and feeds it to the store as {@link Action.TerminalOutput} actions.
 *
 * <p>Bytes already available are coalesced into one chunk of at most {@code chunkBytes}. Each emitted action holds
 * one of {@code maxInFlight} permits until the store has applied it; when none is left the pump stops reading, so
 * the PTY buffer fills and the child blocks on its own writes.
 *
 * <p>At end of stream the pump reports {@link Action.TerminalExited} unless it was cancelled.
 *
 * @since 1.0
 */
final class OutputPump implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputPump.class);

  private final String sessionId;
  private final PtyProcessController controller;
  private final ActionSink sink;
  private final int chunkBytes;
  private final Semaphore inFlight;
  private final Utf8ChunkDecoder decoder;

  private volatile boolean cancelled;
  private volatile Thread thread;

  OutputPump(final String sessionId, final PtyProcessController controller, final ActionSink sink,
      final int chunkBytes, final int maxInFlight) {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(controller, "controller must not be null");
    Validate.notNull(sink, "sink must not be null");
    Validate.isTrue(chunkBytes > 0, "chunkBytes must be positive");
    Validate.isTrue(maxInFlight > 0, "maxInFlight must be positive");
    this.sessionId = sessionId;
    this.controller = controller;
    this.sink = sink;
    this.chunkBytes = chunkBytes;
    this.inFlight = new Semaphore(maxInFlight);
    this.decoder = new Utf8ChunkDecoder(chunkBytes);
  }

  void start() {
    final Thread t = new Thread(this, "pty-pump-" + sessionId);
    t.setDaemon(true);
    this.thread = t;
    t.start();
  }

  /**
   * Stops the pump. No action is submitted after this returns, apart from one already past its permit.
   */
  void cancel() {
    cancelled = true;
    final Thread t = thread;
    if (t != null && t != Thread.currentThread()) {
      t.interrupt();
    }
  }

  boolean isCancelled() {
    return cancelled;
  }

  int availablePermits() {
    return inFlight.availablePermits();
  }

  @Override
  public void run() {
    final InputStream in = controller.output();
    final byte[] buffer = new byte[chunkBytes];
    try {
      boolean eof = false;
      while (!cancelled && !eof) {
        int n = in.read(buffer, 0, chunkBytes);
        if (n < 0) {
          break;
        }
        while (n < chunkBytes && in.available() > 0) {
          final int more = in.read(buffer, n, Math.min(chunkBytes - n, in.available()));
          if (more < 0) {
            eof = true;
            break;
          }
          n += more;
        }
        emit(decoder.decode(buffer, n));
      }
      emit(decoder.finish());
    } catch (final IOException e) {
      // a PTY reports a closed slave side as an I/O error rather than end of stream
      LOGGER.debug("Session {} output closed: {}", sessionId, e.getMessage());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Session {} pump interrupted", sessionId);
    }

    if (!cancelled) {
      submitExit();
    }
  }

  private void emit(final String text) throws InterruptedException {
    if (text.isEmpty() || cancelled) {
      return;
    }
    inFlight.acquire();
    final CompletableFuture<?> applied;
    try {
      applied = sink.submit(new Action.TerminalOutput(sessionId, text));
    } catch (final RuntimeException e) {
      inFlight.release();
      throw e;
    }
    applied.whenComplete((result, error) -> inFlight.release());
  }

  private void submitExit() {
    Integer code;
    try {
      code = controller.onExit().get(1, TimeUnit.SECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      code = -1;
    } catch (final ExecutionException | TimeoutException e) {
      LOGGER.debug("Session {} exit code unavailable: {}", sessionId, e.toString());
      code = -1;
    }
    LOGGER.info("Session {} exited with {}", sessionId, code);
    sink.submit(new Action.TerminalExited(sessionId, code));
  }
}
