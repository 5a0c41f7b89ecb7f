package com.consullo.workbench.store;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.action.ActionCodec;
import com.consullo.workbench.action.ActionSink;
import com.consullo.workbench.config.WorkbenchConfig;
import com.consullo.workbench.effects.ClaudeCliCompletionBackend;
import com.consullo.workbench.effects.CompletionBackend;
import com.consullo.workbench.effects.DirectoryLister;
import com.consullo.workbench.effects.EffectScheduler;
import com.consullo.workbench.effects.FileSystemDirectoryLister;
import com.consullo.workbench.persistence.PersistenceException;
import com.consullo.workbench.persistence.PersistenceLayer;
import com.consullo.workbench.persistence.SqlitePersistenceLayer;
import com.consullo.workbench.pty.PtyProcessControllerPty4j;
import com.consullo.workbench.pty.PtyProcessLauncher;
import com.consullo.workbench.reducer.Effect;
import com.consullo.workbench.reducer.Reducer;
import com.consullo.workbench.reducer.Transition;
import com.consullo.workbench.session.SessionRegistry;
import com.consullo.workbench.state.AppState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The process-owned state store.
 *
 * <p>All actions, whatever thread submits them, are applied one at a time on a single mutation thread, in the order
 * the queue receives them. For each action the store:
 * <ol>
 *   <li>rejects writes and resizes addressed to a session the registry does not know,</li>
 *   <li>runs the {@link Reducer} and commits the resulting state,</li>
 *   <li>runs foreground effects (durable records, session control) and hands background effects to the
 *       {@link EffectScheduler},</li>
 *   <li>broadcasts the new snapshot if the state changed, then acknowledges the action.</li>
 * </ol>
 * The recovery snapshot is written afterwards on a separate thread, keeping only the newest pending state.
 *
 * <p>Typical use:
 * <pre>{@code
 * try (StateStore store = StateStore.create(WorkbenchConfig.fromSystemProperties())) {
 *   store.subscribe(snapshot -> render(snapshot.toJson()));
 *   store.dispatch(new Action.OpenProject("/home/me/repo"));
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class StateStore implements ActionSink, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateStore.class);

  private final Reducer reducer;
  private final PersistenceLayer persistence;
  private final SessionRegistry registry;
  private final EffectScheduler scheduler;
  private final ActionCodec codec = new ActionCodec();
  private final StateBroadcaster broadcaster = new StateBroadcaster();

  private final ExecutorService mutations;
  private final ExecutorService snapshotWriter;
  private final AtomicReference<AppState> pendingSave = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile Thread mutationThread;
  private volatile StateSnapshot current;

  private StateStore(final Builder builder, final PersistenceLayer persistence) {
    this.reducer = builder.reducer == null ? Reducer.forConfig(builder.config) : builder.reducer;
    this.persistence = persistence;
    this.registry = SessionRegistry.create(builder.config, builder.ptyLauncher, this);
    this.scheduler = new EffectScheduler(this, registry, builder.completionBackend, builder.directoryLister,
        persistence);

    this.current = new StateSnapshot(0, restore(persistence));

    this.mutations = Executors.newSingleThreadExecutor(r -> {
      final Thread t = new Thread(r, "workbench-dispatch");
      t.setDaemon(true);
      mutationThread = t;
      return t;
    });
    this.snapshotWriter = Executors.newSingleThreadExecutor(r -> {
      final Thread t = new Thread(r, "workbench-snapshot");
      t.setDaemon(true);
      return t;
    });
    LOGGER.info("State store started with {} open project(s)", current.state().projects().size());
  }

  public static StateStore create(final WorkbenchConfig config) throws PersistenceException {
    return builder(config).build();
  }

  public static Builder builder(final WorkbenchConfig config) {
    return new Builder(config);
  }

  /**
   * Latest committed snapshot. Does not enqueue anything.
   *
   * @return snapshot
   */
  public StateSnapshot getState() {
    return current;
  }

  public Subscription subscribe(final StateListener listener) {
    return broadcaster.add(listener);
  }

  /**
   * Applies an action and waits until it is committed, its records are durable and subscribers were notified.
   *
   * @param action action
   * @return the snapshot after the action
   * @throws InvalidActionException if the action was rejected as malformed
   * @throws UnknownSessionException if the action addressed an unknown terminal session
   * @throws DispatchException if the caller was interrupted while waiting
   * @throws IllegalStateException if called from the mutation thread or after {@link #close()}
   */
  public StateSnapshot dispatch(final Action action) throws DispatchException {
    if (Thread.currentThread() == mutationThread) {
      throw new IllegalStateException("dispatch must not be called from the mutation thread; use submit");
    }
    try {
      return submit(action).get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DispatchException("Interrupted while dispatching " + action.type().wireName(), e);
    } catch (final ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof DispatchException de) {
        throw de;
      }
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      throw new DispatchException("Failed to dispatch " + action.type().wireName(), cause);
    }
  }

  /**
   * Decodes a {@code {type, payload}} envelope and dispatches it.
   *
   * @param json envelope
   * @return the snapshot after the action
   * @throws DispatchException see {@link #dispatch(Action)}
   */
  public StateSnapshot dispatchJson(final String json) throws DispatchException {
    final Action action;
    try {
      action = codec.decode(json);
    } catch (final InvalidActionException e) {
      LOGGER.debug("Rejected action envelope: {}", e.getMessage());
      throw e;
    }
    return dispatch(action);
  }

  /**
   * Enqueues an action.
   *
   * @param action action
   * @return completes with the resulting snapshot, or exceptionally with the {@link DispatchException} that
   *     rejected the action; fails with {@link IllegalStateException} once the store is closed
   */
  @Override
  public CompletableFuture<StateSnapshot> submit(final Action action) {
    Validate.notNull(action, "action must not be null");
    if (closed.get()) {
      return CompletableFuture.failedFuture(new IllegalStateException("State store is closed"));
    }
    final CompletableFuture<StateSnapshot> result = new CompletableFuture<>();
    try {
      mutations.execute(() -> apply(action, result));
    } catch (final RejectedExecutionException e) {
      result.completeExceptionally(new IllegalStateException("State store is closed", e));
    }
    return result;
  }

  /**
   * Waits until every action enqueued before this call has been applied.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void drain() throws InterruptedException {
    Validate.validState(Thread.currentThread() != mutationThread, "drain must not be called from the mutation thread");
    final CompletableFuture<Void> barrier = new CompletableFuture<>();
    try {
      mutations.execute(() -> barrier.complete(null));
    } catch (final RejectedExecutionException e) {
      return;
    }
    try {
      barrier.get();
    } catch (final ExecutionException e) {
      throw new IllegalStateException("drain barrier failed", e.getCause());
    }
  }

  public SessionRegistry sessions() {
    return registry;
  }

  public PersistenceLayer persistence() {
    return persistence;
  }

  private void apply(final Action action, final CompletableFuture<StateSnapshot> result) {
    final StateSnapshot before = current;
    try {
      requireKnownSession(action);
    } catch (final UnknownSessionException e) {
      LOGGER.debug("Rejected {}: {}", action.type().wireName(), e.getMessage());
      result.completeExceptionally(e);
      return;
    }

    final Transition transition;
    try {
      transition = reducer.reduce(before.state(), action);
    } catch (final RuntimeException e) {
      LOGGER.error("Transition failed for {}", action.type().wireName(), e);
      result.completeExceptionally(e);
      return;
    }

    final AppState next = transition.state();
    final boolean changed = next != before.state() && !next.equals(before.state());
    final StateSnapshot committed = changed ? new StateSnapshot(before.revision() + 1, next) : before;
    current = committed;

    run(transition.effects());

    if (changed) {
      broadcaster.publish(committed);
      scheduleSnapshot(next);
    }
    result.complete(committed);
  }

  private void requireKnownSession(final Action action) throws UnknownSessionException {
    if (action instanceof Action.WriteTerminal w && !registry.contains(w.sessionId())) {
      throw new UnknownSessionException(w.sessionId());
    }
    if (action instanceof Action.ResizeTerminal r && !registry.contains(r.sessionId())) {
      throw new UnknownSessionException(r.sessionId());
    }
  }

  private void run(final List<Effect> effects) {
    for (final Effect effect : effects) {
      try {
        execute(effect);
      } catch (final RuntimeException e) {
        LOGGER.warn("Effect {} failed", effect, e);
      }
    }
  }

  private void execute(final Effect effect) {
    if (effect instanceof Effect.AppendRecord e) {
      try {
        persistence.appendRecord(e.kind(), e.projectKey(), e.scope(), e.content());
      } catch (final PersistenceException ex) {
        LOGGER.warn("Failed to persist {} record for project {}", e.kind(), e.projectKey(), ex);
      }
    } else if (effect instanceof Effect.DeleteRecord e) {
      try {
        persistence.deleteRecord(e.projectKey(), e.kind(), e.id());
      } catch (final PersistenceException ex) {
        LOGGER.warn("Failed to delete {} record {}", e.kind(), e.id(), ex);
      }
    } else if (effect instanceof Effect.KillSession e) {
      registry.kill(e.sessionId());
    } else if (effect instanceof Effect.KillWorktreeSessions e) {
      registry.killWorktree(e.worktreeId());
    } else if (effect instanceof Effect.WriteSession e) {
      try {
        registry.write(e.sessionId(), e.data().getBytes(StandardCharsets.UTF_8));
      } catch (final UnknownSessionException | IOException ex) {
        LOGGER.warn("Write to session {} failed: {}", e.sessionId(), ex.getMessage());
      }
    } else if (effect instanceof Effect.ResizeSession e) {
      try {
        registry.resize(e.sessionId(), e.cols(), e.rows());
      } catch (final UnknownSessionException | IOException ex) {
        LOGGER.warn("Resize of session {} failed: {}", e.sessionId(), ex.getMessage());
      }
    } else if (effect instanceof Effect.CancelCompletion e) {
      scheduler.cancelCompletion(e.worktreeId());
    } else if (effect instanceof Effect.SpawnSession e) {
      scheduler.spawnTerminal(e);
    } else if (effect instanceof Effect.LoadDirectory e) {
      scheduler.loadDirectory(e);
    } else if (effect instanceof Effect.LoadComments e) {
      scheduler.loadComments(e);
    } else if (effect instanceof Effect.CopyEnvFiles e) {
      scheduler.copyEnvFiles(e);
    } else if (effect instanceof Effect.StartCompletion e) {
      if (!scheduler.runChatCompletion(e)) {
        submit(new Action.FailChatMessage(e.worktreeId(), e.messageId(), "A response is already streaming"));
      }
    } else {
      throw new IllegalStateException("Unhandled effect " + effect);
    }
  }

  private void scheduleSnapshot(final AppState state) {
    if (pendingSave.getAndSet(state) == null) {
      try {
        snapshotWriter.execute(this::writePendingSnapshot);
      } catch (final RejectedExecutionException e) {
        LOGGER.debug("Snapshot writer stopped; final snapshot is written on close");
      }
    }
  }

  private void writePendingSnapshot() {
    final AppState state = pendingSave.getAndSet(null);
    if (state == null) {
      return;
    }
    try {
      persistence.saveSnapshot(state);
    } catch (final PersistenceException e) {
      LOGGER.warn("Failed to write recovery snapshot", e);
    }
  }

  private static AppState restore(final PersistenceLayer persistence) {
    try {
      return persistence.loadSnapshot().map(StateRecovery::sanitize).orElseGet(AppState::initial);
    } catch (final PersistenceException e) {
      LOGGER.warn("Recovery snapshot unavailable, starting fresh", e);
      return AppState.initial();
    }
  }

  /**
   * Stops accepting actions, applies what is queued, kills every session, cancels completions, writes a final
   * snapshot and closes persistence.
   */
  @Override
  public void close() {
    Validate.validState(Thread.currentThread() != mutationThread, "close must not be called from the mutation thread");
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info("Shutting down state store at revision {}", current.revision());
    mutations.shutdown();
    await(mutations, "mutation queue");
    scheduler.close();
    registry.close();
    snapshotWriter.shutdown();
    await(snapshotWriter, "snapshot writer");
    pendingSave.set(null);
    try {
      persistence.saveSnapshot(current.state());
    } catch (final PersistenceException e) {
      LOGGER.warn("Failed to write final snapshot", e);
    }
    persistence.close();
    LOGGER.info("State store stopped");
  }

  private static void await(final ExecutorService executor, final String name) {
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("{} did not stop in time", name);
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  /**
   * Wires a store to its collaborators. Anything not set uses the production implementation.
   */
  public static final class Builder {

    private final WorkbenchConfig config;
    private PtyProcessLauncher ptyLauncher = PtyProcessControllerPty4j::new;
    private CompletionBackend completionBackend;
    private DirectoryLister directoryLister = new FileSystemDirectoryLister();
    private PersistenceLayer persistence;
    private Reducer reducer;

    private Builder(final WorkbenchConfig config) {
      this.config = Validate.notNull(config, "config must not be null");
      this.completionBackend = ClaudeCliCompletionBackend.create(config);
    }

    public Builder ptyLauncher(final PtyProcessLauncher launcher) {
      this.ptyLauncher = Validate.notNull(launcher, "launcher must not be null");
      return this;
    }

    public Builder completionBackend(final CompletionBackend backend) {
      this.completionBackend = Validate.notNull(backend, "backend must not be null");
      return this;
    }

    public Builder directoryLister(final DirectoryLister lister) {
      this.directoryLister = Validate.notNull(lister, "lister must not be null");
      return this;
    }

    public Builder persistence(final PersistenceLayer layer) {
      this.persistence = Validate.notNull(layer, "layer must not be null");
      return this;
    }

    public Builder reducer(final Reducer value) {
      this.reducer = Validate.notNull(value, "reducer must not be null");
      return this;
    }

    /**
     * Builds and starts the store.
     *
     * @return running store
     * @throws PersistenceException if the default database cannot be opened
     */
    public StateStore build() throws PersistenceException {
      final PersistenceLayer layer = persistence == null ? SqlitePersistenceLayer.open(config) : persistence;
      return new StateStore(this, layer);
    }
  }
}
