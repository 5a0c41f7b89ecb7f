package com.consullo.workbench.pty;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Launcher producing {@link FakePtyProcessController}s, optionally failing every launch or stalling their input.
 */
public final class FakePtyLauncher implements PtyProcessLauncher {

  private final List<FakePtyProcessController> launched = new CopyOnWriteArrayList<>();
  private volatile boolean failing;
  private volatile int stallInputAfter = -1;

  public FakePtyLauncher failing() {
    this.failing = true;
    return this;
  }

  public FakePtyLauncher stallingInputAfter(final int bytes) {
    this.stallInputAfter = bytes;
    return this;
  }

  @Override
  public PtyProcessController launch(final PtyProcessConfig config) throws IOException {
    if (failing) {
      throw new IOException("no such shell: " + config.command().get(0));
    }
    final FakePtyProcessController controller = new FakePtyProcessController(config);
    if (stallInputAfter >= 0) {
      controller.stallInputAfter(stallInputAfter);
    }
    launched.add(controller);
    return controller;
  }

  public List<FakePtyProcessController> launched() {
    return launched;
  }

  public FakePtyProcessController last() {
    return launched.get(launched.size() - 1);
  }
}
