package com.consullo.workbench.session;

import com.consullo.workbench.pty.PtyProcessController;
import java.io.IOException;
import org.apache.commons.lang3.Validate;

/**
 * A live terminal: the PTY process with its output pump and input writer. Owned by exactly one {@link SessionRegistry} entry.
 *
 * @since 1.0
 */
public final class TerminalSession {

  private final String id;
  private final String worktreeId;
  private final PtyProcessController controller;
  private final OutputPump pump;
  private final InputWriter writer;

  TerminalSession(final String id, final String worktreeId, final PtyProcessController controller,
      final OutputPump pump, final InputWriter writer) {
    Validate.notBlank(id, "id must not be blank");
    Validate.notBlank(worktreeId, "worktreeId must not be blank");
    this.id = id;
    this.worktreeId = worktreeId;
    this.controller = Validate.notNull(controller, "controller must not be null");
    this.pump = Validate.notNull(pump, "pump must not be null");
    this.writer = Validate.notNull(writer, "writer must not be null");
  }

  public String id() {
    return id;
  }

  public String worktreeId() {
    return worktreeId;
  }

  public long pid() {
    return controller.pid();
  }

  void write(final byte[] bytes) throws IOException {
    writer.enqueue(bytes);
  }

  void resize(final int cols, final int rows) throws IOException {
    controller.resize(cols, rows);
  }

  void close() {
    writer.cancel();
    pump.cancel();
    controller.close();
  }
}
