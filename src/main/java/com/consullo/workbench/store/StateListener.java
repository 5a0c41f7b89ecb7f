package com.consullo.workbench.store;

/**
 * Receives every committed state, in commit order, on the store's mutation thread. Implementations must return
 * quickly and must not call {@link StateStore#dispatch}; use {@link StateStore#submit} instead.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface StateListener {

  void onState(StateSnapshot snapshot);
}
