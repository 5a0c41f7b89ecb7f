package com.consullo.workbench.effects;

/**
 * Receives streamed text as it arrives.
 */
@FunctionalInterface
public interface CompletionSink {

  void delta(String text);
}
