package com.consullo.workbench.effects;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.action.ActionSink;
import com.consullo.workbench.persistence.PersistedRecord;
import com.consullo.workbench.persistence.PersistenceException;
import com.consullo.workbench.persistence.PersistenceLayer;
import com.consullo.workbench.persistence.RecordKind;
import com.consullo.workbench.reducer.Effect;
import com.consullo.workbench.session.SessionRegistry;
import com.consullo.workbench.session.SpawnFailureException;
import com.consullo.workbench.state.FileComment;
import com.consullo.workbench.state.FileEntry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs background effects and reports their outcome as follow-up actions.
 *
 * <p>Nothing here touches state. Every result, failures included, re-enters the store through the
 * {@link ActionSink}, tagged with the worktree, path or message it belongs to.
 *
 * <p>A worktree has at most one running completion. Cancelling one interrupts its task and stops it from submitting
 * anything further.
 *
 * @since 1.0
 */
public final class EffectScheduler implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(EffectScheduler.class);

  private final ActionSink sink;
  private final SessionRegistry registry;
  private final CompletionBackend completions;
  private final DirectoryLister lister;
  private final PersistenceLayer persistence;
  private final EnvFileCopier envCopier;
  private final ExecutorService pool;
  private final Map<String, RunningCompletion> running = new ConcurrentHashMap<>();

  public EffectScheduler(final ActionSink sink, final SessionRegistry registry, final CompletionBackend completions,
      final DirectoryLister lister, final PersistenceLayer persistence) {
    this.sink = Validate.notNull(sink, "sink must not be null");
    this.registry = Validate.notNull(registry, "registry must not be null");
    this.completions = Validate.notNull(completions, "completions must not be null");
    this.lister = Validate.notNull(lister, "lister must not be null");
    this.persistence = Validate.notNull(persistence, "persistence must not be null");
    this.envCopier = new EnvFileCopier();
    this.pool = Executors.newCachedThreadPool(daemonThreads("workbench-effect-"));
  }

  public void spawnTerminal(final Effect.SpawnSession effect) {
    pool.execute(() -> {
      try {
        registry.spawn(effect.worktreeId(), Path.of(effect.cwd()), effect.cols(), effect.rows());
      } catch (final SpawnFailureException e) {
        final Throwable cause = e.getCause() == null ? e : e.getCause();
        sink.submit(new Action.TerminalSpawnFailed(effect.worktreeId(), e.getMessage() + ": " + cause.getMessage()));
      } catch (final RuntimeException e) {
        LOGGER.warn("Spawn for worktree {} failed", effect.worktreeId(), e);
        sink.submit(new Action.TerminalSpawnFailed(effect.worktreeId(), e.toString()));
      }
    });
  }

  public void loadDirectory(final Effect.LoadDirectory effect) {
    pool.execute(() -> {
      try {
        final List<FileEntry> entries = lister.list(Path.of(effect.path()));
        sink.submit(new Action.SetDirectoryCache(effect.worktreeId(), effect.path(), entries));
      } catch (final IOException | RuntimeException e) {
        LOGGER.warn("Failed to read directory {}: {}", effect.path(), e.toString());
        sink.submit(new Action.DirectoryLoadFailed(effect.worktreeId(), effect.path(),
            "Cannot read " + effect.path() + ": " + e.getMessage()));
      }
    });
  }

  public void loadComments(final Effect.LoadComments effect) {
    pool.execute(() -> {
      try {
        final List<FileComment> comments = new ArrayList<>();
        for (final PersistedRecord r : persistence.queryRecords(effect.projectKey(), RecordKind.COMMENT,
            effect.path())) {
          comments.add(r.toComment());
        }
        sink.submit(new Action.SetFileComments(effect.worktreeId(), effect.path(), comments));
      } catch (final PersistenceException e) {
        LOGGER.warn("Failed to load comments for {}", effect.path(), e);
      }
    });
  }

  public void copyEnvFiles(final Effect.CopyEnvFiles effect) {
    pool.execute(() -> {
      try {
        final EnvFileCopier.Result result =
            envCopier.copy(Path.of(effect.from()), Path.of(effect.to()), effect.patterns());
        LOGGER.info("Copied {} env file(s) from {} to {}", result.copied().size(), effect.from(), effect.to());
        sink.submit(new Action.EnvFilesCopied(effect.worktreeId(), result.copied(), result.failed()));
      } catch (final IOException | RuntimeException e) {
        LOGGER.warn("Failed to copy env files from {} to {}: {}", effect.from(), effect.to(), e.toString());
        sink.submit(new Action.EnvFilesCopied(effect.worktreeId(), List.of(),
            List.of(String.join(", ", effect.patterns()) + ": " + e.getMessage())));
      }
    });
  }

  /**
   * Starts streaming a completion.
   *
   * @param effect completion to run
   * @return {@code false} if the worktree already has a running completion; nothing is started then
   */
  public boolean runChatCompletion(final Effect.StartCompletion effect) {
    final RunningCompletion handle = new RunningCompletion(effect.messageId());
    if (running.putIfAbsent(effect.worktreeId(), handle) != null) {
      return false;
    }
    final CompletionRequest request = new CompletionRequest(effect.worktreeId(), effect.messageId(),
        Path.of(effect.cwd()), effect.prompt(), effect.history());
    handle.future = pool.submit(() -> stream(request, handle));
    if (handle.cancelled) {
      handle.future.cancel(true);
    }
    return true;
  }

  public boolean cancelCompletion(final String worktreeId) {
    final RunningCompletion handle = running.remove(worktreeId);
    if (handle == null) {
      return false;
    }
    LOGGER.debug("Cancelling completion {} of {}", handle.messageId, worktreeId);
    handle.cancel();
    return true;
  }

  public boolean isCompletionRunning(final String worktreeId) {
    return running.containsKey(worktreeId);
  }

  public void cancelAll() {
    for (final String worktreeId : new ArrayList<>(running.keySet())) {
      cancelCompletion(worktreeId);
    }
  }

  @Override
  public void close() {
    cancelAll();
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(2, TimeUnit.SECONDS)) {
        LOGGER.warn("Effect tasks still running after shutdown");
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void stream(final CompletionRequest request, final RunningCompletion handle) {
    final String worktreeId = request.worktreeId();
    final String messageId = request.messageId();
    try {
      completions.stream(request, text -> {
        if (!handle.cancelled) {
          sink.submit(new Action.UpdateChatMessage(worktreeId, messageId, text));
        }
      });
      finish(worktreeId, handle, new Action.CompleteChatMessage(worktreeId, messageId));
    } catch (final CompletionFailureException e) {
      LOGGER.warn("Completion {} failed: {}", messageId, e.getMessage());
      finish(worktreeId, handle, new Action.FailChatMessage(worktreeId, messageId, e.getMessage()));
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Completion {} interrupted", messageId);
    } catch (final RuntimeException e) {
      LOGGER.warn("Completion {} failed", messageId, e);
      finish(worktreeId, handle, new Action.FailChatMessage(worktreeId, messageId, e.toString()));
    } finally {
      running.remove(worktreeId, handle);
    }
  }

  // The slot is released before the final action is queued, so the next submission can start right away.
  private void finish(final String worktreeId, final RunningCompletion handle, final Action last) {
    running.remove(worktreeId, handle);
    if (!handle.cancelled) {
      sink.submit(last);
    }
  }

  static ThreadFactory daemonThreads(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return r -> {
      final Thread t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private static final class RunningCompletion {
    private final String messageId;
    private volatile boolean cancelled;
    private volatile Future<?> future;

    private RunningCompletion(final String messageId) {
      this.messageId = messageId;
    }

    private void cancel() {
      cancelled = true;
      final Future<?> f = future;
      if (f != null) {
        f.cancel(true);
      }
    }
  }
}
