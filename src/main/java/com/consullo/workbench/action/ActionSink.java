package com.consullo.workbench.action;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point used by background producers to re-enter the mutation queue.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ActionSink {

  /**
   * Enqueues an action without waiting for it.
   *
   * @param action action to apply
   * @return completes once the action was applied, exceptionally when it was rejected
   */
  CompletableFuture<?> submit(Action action);
}
