package com.consullo.workbench.state;

import org.apache.commons.lang3.Validate;

/**
 * Entry of the "open recent" list.
 *
 * @param path project path
 * @param name display name
 */
public record RecentProject(String path, String name) {

  public RecentProject {
    Validate.notBlank(path, "path must not be blank");
    Validate.notNull(name, "name must not be null");
  }
}
