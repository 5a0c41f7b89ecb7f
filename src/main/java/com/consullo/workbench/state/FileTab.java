package com.consullo.workbench.state;

import org.apache.commons.lang3.Validate;

/**
 * An open editor tab.
 *
 * <p>A tab that is not pinned is the preview tab; an explorer holds at most one.
 *
 * @param path file path
 * @param pinned whether the tab survives the next file open
 * @param scrollPosition last scroll position reported by the viewer
 */
public record FileTab(String path, boolean pinned, int scrollPosition) {

  public FileTab {
    Validate.notBlank(path, "path must not be blank");
    Validate.isTrue(scrollPosition >= 0, "scrollPosition must not be negative");
  }

  public static FileTab preview(final String path) {
    return new FileTab(path, false, 0);
  }

  public FileTab pin() {
    return pinned ? this : new FileTab(path, true, scrollPosition);
  }

  public FileTab withScrollPosition(final int position) {
    return new FileTab(path, pinned, position);
  }
}
