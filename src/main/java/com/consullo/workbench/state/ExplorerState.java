package com.consullo.workbench.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Worktree-scoped file explorer state.
 *
 * <p>{@code directoryCache} is filled lazily the first time a directory is explored or expanded and is only
 * evicted by an explicit refresh. {@code loadingPaths} holds directories whose read is outstanding, so a second
 * expand of the same directory does not start another read.
 *
 * @param currentPath directory shown in the main listing, or {@code null}
 * @param expandedPaths directories expanded in the tree
 * @param directoryCache directory path to its ordered entries
 * @param loadingPaths directories with an outstanding read
 * @param openTabs open tabs in display order
 * @param activeTabPath path of the active tab, or {@code null}
 * @param selectedPath selected file, or {@code null}
 * @param selectedComments comments of the selected file
 * @since 1.0
 */
public record ExplorerState(
    String currentPath,
    Set<String> expandedPaths,
    Map<String, List<FileEntry>> directoryCache,
    Set<String> loadingPaths,
    List<FileTab> openTabs,
    String activeTabPath,
    String selectedPath,
    List<FileComment> selectedComments) {

  public static final ExplorerState EMPTY =
      new ExplorerState(null, Set.of(), Map.of(), Set.of(), List.of(), null, null, List.of());

  public ExplorerState {
    expandedPaths = orderedSet(expandedPaths);
    loadingPaths = orderedSet(loadingPaths);
    directoryCache = orderedCache(directoryCache);
    openTabs = openTabs == null ? List.of() : List.copyOf(openTabs);
    selectedComments = selectedComments == null ? List.of() : List.copyOf(selectedComments);
  }

  public boolean isCached(final String path) {
    return directoryCache.containsKey(path);
  }

  public ExplorerState withCurrentPath(final String path) {
    return new ExplorerState(path, expandedPaths, directoryCache, loadingPaths, openTabs, activeTabPath,
        selectedPath, selectedComments);
  }

  public ExplorerState withExpandedPaths(final Set<String> paths) {
    return new ExplorerState(currentPath, paths, directoryCache, loadingPaths, openTabs, activeTabPath,
        selectedPath, selectedComments);
  }

  public ExplorerState withDirectoryCache(final Map<String, List<FileEntry>> cache) {
    return new ExplorerState(currentPath, expandedPaths, cache, loadingPaths, openTabs, activeTabPath,
        selectedPath, selectedComments);
  }

  public ExplorerState withLoadingPaths(final Set<String> paths) {
    return new ExplorerState(currentPath, expandedPaths, directoryCache, paths, openTabs, activeTabPath,
        selectedPath, selectedComments);
  }

  public ExplorerState withTabs(final List<FileTab> tabs, final String activePath) {
    return new ExplorerState(currentPath, expandedPaths, directoryCache, loadingPaths, tabs, activePath,
        selectedPath, selectedComments);
  }

  public ExplorerState withSelection(final String path, final List<FileComment> comments) {
    return new ExplorerState(currentPath, expandedPaths, directoryCache, loadingPaths, openTabs, activeTabPath,
        path, comments);
  }

  private static Set<String> orderedSet(final Set<String> source) {
    if (source == null || source.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(source));
  }

  private static Map<String, List<FileEntry>> orderedCache(final Map<String, List<FileEntry>> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    final Map<String, List<FileEntry>> copy = new LinkedHashMap<>(source.size() * 2);
    source.forEach((path, entries) -> copy.put(path, List.copyOf(entries)));
    return Collections.unmodifiableMap(copy);
  }
}
