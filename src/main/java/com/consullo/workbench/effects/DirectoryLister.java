package com.consullo.workbench.effects;

import com.consullo.workbench.state.FileEntry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads one directory level for the explorer.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DirectoryLister {

  List<FileEntry> list(Path directory) throws IOException;
}
