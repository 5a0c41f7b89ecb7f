package com.consullo.workbench.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of a directory entry.
 */
public enum FileKind {
  @JsonProperty("file") FILE,
  @JsonProperty("directory") DIRECTORY,
  @JsonProperty("symlink") SYMLINK
}
