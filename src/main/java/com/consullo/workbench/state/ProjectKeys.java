package com.consullo.workbench.state;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide memo of derived project keys, so each distinct path is hashed once.
 */
public final class ProjectKeys {

  private static final Map<String, ProjectKey> KEYS = new ConcurrentHashMap<>();

  private ProjectKeys() {
  }

  public static ProjectKey of(final String path) {
    return KEYS.computeIfAbsent(path, ProjectKey::derive);
  }
}
