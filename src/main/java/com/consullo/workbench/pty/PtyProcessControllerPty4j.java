package com.consullo.workbench.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PTY controller implemented with pty4j.
 *
 * <p>The child inherits this process's environment overlaid with {@link PtyProcessConfig#environment()} and starts
 * at the configured size.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration (command, working directory, environment, initial size)
   * @throws IOException if the process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws IOException {
    Validate.notNull(config, "config must not be null");

    final Map<String, String> env = new HashMap<>(System.getenv());
    env.putAll(config.environment());

    final PtyProcessBuilder builder = new PtyProcessBuilder(config.command().toArray(new String[0]))
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(env)
        .setInitialColumns(config.initialColumns())
        .setInitialRows(config.initialRows())
        .setRedirectErrorStream(true);

    this.process = builder.start();
    LOGGER.debug("Started {} as pid {}", config.command(), this.process.pid());
    startExitMonitorThread();
  }

  @Override
  public InputStream output() {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream input() {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) throws IOException {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    try {
      this.process.setWinSize(new WinSize(columns, rows));
    } catch (final IllegalStateException e) {
      throw new IOException("PTY resize failed for pid " + this.process.pid(), e);
    }
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.exitFuture;
  }

  @Override
  public long pid() {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    this.process.destroy();
    // escalate without blocking the caller
    CompletableFuture.runAsync(() -> {
      if (this.process.isAlive()) {
        LOGGER.warn("pid {} did not exit after destroy, killing forcibly", this.process.pid());
        this.process.destroyForcibly();
      }
    }, CompletableFuture.delayedExecutor(2, TimeUnit.SECONDS));
  }

  /**
   * Starts a monitor thread that completes the exit future when the subprocess terminates.
   */
  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        this.exitFuture.complete(this.process.waitFor());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      }
    }, "pty-exit-" + this.process.pid());
    monitor.setDaemon(true);
    monitor.start();
  }
}
