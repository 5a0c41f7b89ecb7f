package com.consullo.workbench.effects;

import com.consullo.workbench.state.FileEntry;
import com.consullo.workbench.state.FileKind;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lists a directory from the local file system. Hidden entries are included, version control metadata is not.
 */
public final class FileSystemDirectoryLister implements DirectoryLister {

  private static final Set<String> EXCLUDED = Set.of(".git");

  @Override
  public List<FileEntry> list(final Path directory) throws IOException {
    final List<FileEntry> entries = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (final Path child : stream) {
        final String name = child.getFileName().toString();
        if (EXCLUDED.contains(name)) {
          continue;
        }
        final BasicFileAttributes attrs =
            Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        final FileKind kind = attrs.isSymbolicLink() ? FileKind.SYMLINK
            : attrs.isDirectory() ? FileKind.DIRECTORY : FileKind.FILE;
        entries.add(new FileEntry(name, child.toAbsolutePath().toString(), kind,
            kind == FileKind.FILE ? attrs.size() : 0L));
      }
    }
    entries.sort(FileEntry.DISPLAY_ORDER);
    return entries;
  }
}
