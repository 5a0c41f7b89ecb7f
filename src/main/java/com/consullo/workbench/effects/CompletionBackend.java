package com.consullo.workbench.effects;

/**
 * Streaming completion backend.
 *
 * <p>{@link #stream} blocks until the completion is done, reporting text through the sink as it arrives. Returning
 * normally means done; a backend error is raised as {@link CompletionFailureException}. Implementations must stop
 * promptly when the calling thread is interrupted.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CompletionBackend {

  void stream(CompletionRequest request, CompletionSink sink) throws CompletionFailureException, InterruptedException;
}
