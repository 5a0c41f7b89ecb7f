package com.consullo.workbench.demo;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.config.WorkbenchConfig;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.FileEntry;
import com.consullo.workbench.state.FileKind;
import com.consullo.workbench.state.TerminalState;
import com.consullo.workbench.state.TerminalStatus;
import com.consullo.workbench.state.WorktreeState;
import com.consullo.workbench.store.StateSnapshot;
import com.consullo.workbench.store.StateStore;
import com.consullo.workbench.store.Subscription;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless run of the store: opens a project, lists its root, runs one shell command in a terminal and prints the
 * output tail seen in broadcast snapshots.
 *
 * <p>Usage: {@code WorkbenchDemo [project-dir]} (default: working directory). Set {@code -Dworkbench.dataDir} to keep
 * the database and recovery file out of your home directory.
 *
 * @since 1.0
 */
public final class WorkbenchDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkbenchDemo.class);

  private static final long TIMEOUT_MILLIS = 10_000L;

  private WorkbenchDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional project directory
   * @throws Exception if the demo fails
   */
  public static void main(final String[] args) throws Exception {
    final Path project = Path.of(args.length > 0 ? args[0] : ".").toAbsolutePath().normalize();
    final WorkbenchConfig config = WorkbenchConfig.fromSystemProperties();
    final AtomicReference<StateSnapshot> latest = new AtomicReference<>();

    try (StateStore store = StateStore.create(config);
        Subscription ignored = store.subscribe(latest::set)) {
      store.dispatch(new Action.OpenProject(project.toString()));
      final String worktreeId = store.getState().state().activeWorktree().id();

      store.dispatch(new Action.ExploreDir(project.toString()));
      final List<FileEntry> entries = await(latest, s -> {
        final WorktreeState wt = s.worktree(worktreeId);
        return wt == null ? null : wt.explorer().directoryCache().get(project.toString());
      });
      System.out.println("=== " + project + " ===");
      for (final FileEntry e : entries) {
        System.out.println((e.kind() == FileKind.DIRECTORY ? "d " : "  ") + e.name());
      }

      store.dispatch(new Action.SpawnTerminal(worktreeId, 120, 32));
      final TerminalState running = await(latest, s -> {
        final TerminalState t = s.worktree(worktreeId).terminal();
        return t.status() == TerminalStatus.RUNNING || t.status() == TerminalStatus.ERROR ? t : null;
      });
      if (running.status() == TerminalStatus.ERROR) {
        LOGGER.warn("Terminal failed to start: {}", running.error());
        return;
      }
      LOGGER.info("Terminal session {} running", running.sessionId());

      store.dispatch(new Action.WriteTerminal(running.sessionId(), "echo workbench-demo-done\n"));
      final String output = await(latest, s -> {
        final String out = s.worktree(worktreeId).terminal().output();
        // once for the echoed command line, once for its output
        return StringUtils.countMatches(out, "workbench-demo-done") >= 2 ? out : null;
      });
      System.out.println("=== Terminal output ===");
      System.out.println(output);

      store.dispatch(new Action.KillTerminal(running.sessionId()));
      System.out.println("=== Revision " + store.getState().revision() + " ===");
    }
    LOGGER.info("Demo completed");
  }

  private static <T> T await(final AtomicReference<StateSnapshot> latest,
      final Function<AppState, T> reader) throws InterruptedException {
    final long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
    while (System.currentTimeMillis() < deadline) {
      final StateSnapshot snapshot = latest.get();
      if (snapshot != null) {
        final T value = reader.apply(snapshot.state());
        if (value != null) {
          return value;
        }
      }
      Thread.sleep(50L);
    }
    throw new IllegalStateException("Timed out waiting for state");
  }
}
