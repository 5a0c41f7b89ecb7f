package com.consullo.workbench.session;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.action.ActionSink;
import com.consullo.workbench.config.WorkbenchConfig;
import com.consullo.workbench.pty.PtyProcessConfig;
import com.consullo.workbench.pty.PtyProcessController;
import com.consullo.workbench.pty.PtyProcessLauncher;
import com.consullo.workbench.store.UnknownSessionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Side table of live terminal sessions, keyed by session id.
 *
 * <p>The state tree only stores session ids; the process handles live here and nowhere else. Each entry owns one
 * process, and removing the entry always terminates it. Killing an id that is not registered is a no-op.
 *
 * <p>{@link #spawn} announces the new session with {@link Action.TerminalSpawned} before its pump starts, so the
 * store always learns the id before any output of that session.
 *
 * @since 1.0
 */
public final class SessionRegistry implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

  static final int MAX_PENDING_WRITES = 256;

  static final Map<String, String> TERMINAL_ENV = Map.of("TERM", "xterm-256color", "COLORTERM", "truecolor");

  private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();
  private final PtyProcessLauncher launcher;
  private final ActionSink sink;
  private final List<String> shellCommand;
  private final int chunkBytes;
  private final int maxInFlight;

  public SessionRegistry(final PtyProcessLauncher launcher, final ActionSink sink, final List<String> shellCommand,
      final int chunkBytes, final int maxInFlight) {
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(sink, "sink must not be null");
    Validate.notEmpty(shellCommand, "shellCommand must not be empty");
    Validate.isTrue(chunkBytes > 0, "chunkBytes must be positive");
    Validate.isTrue(maxInFlight > 0, "maxInFlight must be positive");
    this.launcher = launcher;
    this.sink = sink;
    this.shellCommand = List.copyOf(shellCommand);
    this.chunkBytes = chunkBytes;
    this.maxInFlight = maxInFlight;
  }

  public static SessionRegistry create(final WorkbenchConfig config, final PtyProcessLauncher launcher,
      final ActionSink sink) {
    return new SessionRegistry(launcher, sink, config.shellCommand(), config.outputChunkBytes(),
        config.maxInFlightOutput());
  }

  /**
   * Starts a shell for a worktree.
   *
   * @param worktreeId owning worktree
   * @param cwd working directory
   * @param cols initial columns
   * @param rows initial rows
   * @return new session id
   * @throws SpawnFailureException if the process could not be started
   */
  public String spawn(final String worktreeId, final Path cwd, final int cols, final int rows)
      throws SpawnFailureException {
    Validate.notBlank(worktreeId, "worktreeId must not be blank");
    Validate.notNull(cwd, "cwd must not be null");
    Validate.isTrue(cols > 0, "cols must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    final PtyProcessConfig config = new PtyProcessConfig(shellCommand, cwd, TERMINAL_ENV, cols, rows);
    final PtyProcessController controller;
    try {
      controller = launcher.launch(config);
    } catch (final IOException | RuntimeException | LinkageError e) {
      // a missing pty4j native library surfaces as a LinkageError
      LOGGER.warn("Failed to start {} in {}: {}", shellCommand, cwd, e.toString());
      throw new SpawnFailureException("Failed to start " + String.join(" ", shellCommand) + " in " + cwd, e);
    }

    final String id = UUID.randomUUID().toString();
    final OutputPump pump = new OutputPump(id, controller, sink, chunkBytes, maxInFlight);
    final InputWriter writer = new InputWriter(id, controller, MAX_PENDING_WRITES);
    sessions.put(id, new TerminalSession(id, worktreeId, controller, pump, writer));
    LOGGER.info("Session {} started for worktree {} (pid {}, {}x{})", id, worktreeId, controller.pid(), cols, rows);

    sink.submit(new Action.TerminalSpawned(worktreeId, id));
    writer.start();
    pump.start();
    return id;
  }

  /**
   * Queues input for a session. Returns once the bytes are queued; a child that is not reading never blocks the
   * caller.
   *
   * @throws UnknownSessionException if no such session is registered
   * @throws IOException if the session's input is closed or backed up
   */
  public void write(final String id, final byte[] bytes) throws UnknownSessionException, IOException {
    Validate.notNull(bytes, "bytes must not be null");
    require(id).write(bytes);
  }

  public void resize(final String id, final int cols, final int rows) throws UnknownSessionException, IOException {
    Validate.isTrue(cols > 0, "cols must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    require(id).resize(cols, rows);
  }

  /**
   * Terminates a session and removes its entry.
   *
   * @param id session id
   * @return {@code true} if an entry was removed, {@code false} if none existed
   */
  public boolean kill(final String id) {
    if (id == null) {
      return false;
    }
    final TerminalSession session = sessions.remove(id);
    if (session == null) {
      return false;
    }
    LOGGER.info("Killing session {} (pid {})", id, session.pid());
    session.close();
    return true;
  }

  public int killWorktree(final String worktreeId) {
    int killed = 0;
    for (final TerminalSession session : new ArrayList<>(sessions.values())) {
      if (session.worktreeId().equals(worktreeId) && kill(session.id())) {
        killed++;
      }
    }
    return killed;
  }

  public int killAll() {
    int killed = 0;
    for (final String id : new ArrayList<>(sessions.keySet())) {
      if (kill(id)) {
        killed++;
      }
    }
    return killed;
  }

  public boolean contains(final String id) {
    return id != null && sessions.containsKey(id);
  }

  public Set<String> sessionIds() {
    return Set.copyOf(sessions.keySet());
  }

  @Override
  public void close() {
    final int killed = killAll();
    if (killed > 0) {
      LOGGER.info("Killed {} remaining session(s)", killed);
    }
  }

  private TerminalSession require(final String id) throws UnknownSessionException {
    final TerminalSession session = id == null ? null : sessions.get(id);
    if (session == null) {
      throw new UnknownSessionException(id);
    }
    return session;
  }
}
