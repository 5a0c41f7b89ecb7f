package com.consullo.workbench.pty;

import java.io.IOException;

/**
 * Starts PTY processes. The pty4j launcher is {@code PtyProcessControllerPty4j::new}; tests pass fakes.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PtyProcessLauncher {

  PtyProcessController launch(PtyProcessConfig config) throws IOException;
}
