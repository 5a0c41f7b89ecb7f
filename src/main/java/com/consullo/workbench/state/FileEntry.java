package com.consullo.workbench.state;

import java.util.Comparator;
import org.apache.commons.lang3.Validate;

/**
 * One entry of a cached directory listing.
 *
 * @param name file name
 * @param path absolute path
 * @param kind entry kind
 * @param size size in bytes (0 for directories)
 * @since 1.0
 */
public record FileEntry(String name, String path, FileKind kind, long size) {

  /** Directories first, then case-insensitive by name. */
  public static final Comparator<FileEntry> DISPLAY_ORDER = Comparator
      .comparing((FileEntry e) -> e.kind() != FileKind.DIRECTORY)
      .thenComparing(FileEntry::name, String.CASE_INSENSITIVE_ORDER)
      .thenComparing(FileEntry::name);

  public FileEntry {
    Validate.notBlank(name, "name must not be blank");
    Validate.notBlank(path, "path must not be blank");
    Validate.notNull(kind, "kind must not be null");
    Validate.isTrue(size >= 0, "size must not be negative");
  }
}
