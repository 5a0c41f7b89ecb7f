package com.consullo.workbench.store;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans committed snapshots out to listeners. A failing listener is logged and does not affect the others.
 *
 * @since 1.0
 */
final class StateBroadcaster {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateBroadcaster.class);

  private final List<StateListener> listeners = new CopyOnWriteArrayList<>();

  Subscription add(final StateListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  void publish(final StateSnapshot snapshot) {
    for (final StateListener listener : listeners) {
      try {
        listener.onState(snapshot);
      } catch (final RuntimeException e) {
        LOGGER.warn("State listener {} failed on revision {}", listener, snapshot.revision(), e);
      }
    }
  }

  int size() {
    return listeners.size();
  }
}
