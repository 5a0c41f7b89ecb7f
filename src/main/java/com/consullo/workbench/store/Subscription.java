package com.consullo.workbench.store;

/**
 * Handle returned by {@link StateStore#subscribe}; closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

  @Override
  void close();
}
