package com.consullo.workbench.support;

import com.consullo.workbench.action.Action;
import com.consullo.workbench.action.ActionSink;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sink that records submitted actions. By default every submission completes immediately; with
 * {@link #holdCompletions()} the futures stay pending until {@link #completeNext()}.
 */
public final class RecordingSink implements ActionSink {

  private final List<Action> actions = new ArrayList<>();
  private final List<CompletableFuture<Object>> pending = new ArrayList<>();
  private boolean hold;

  public synchronized RecordingSink holdCompletions() {
    this.hold = true;
    return this;
  }

  @Override
  public synchronized CompletableFuture<?> submit(final Action action) {
    actions.add(action);
    final CompletableFuture<Object> future = new CompletableFuture<>();
    if (hold) {
      pending.add(future);
    } else {
      future.complete(null);
    }
    return future;
  }

  public synchronized void completeNext() {
    if (!pending.isEmpty()) {
      pending.remove(0).complete(null);
    }
  }

  public synchronized List<Action> actions() {
    return List.copyOf(actions);
  }

  public synchronized <T extends Action> List<T> actionsOf(final Class<T> type) {
    final List<T> out = new ArrayList<>();
    for (final Action a : actions) {
      if (type.isInstance(a)) {
        out.add(type.cast(a));
      }
    }
    return out;
  }

  public synchronized int size() {
    return actions.size();
  }
}
