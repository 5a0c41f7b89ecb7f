package com.consullo.workbench.effects;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Copies tracked environment files (dotfiles, local config directories) from one worktree into another.
 *
 * <p>Patterns name paths relative to the worktree root. A pattern missing from the source is skipped, and so is one
 * that already exists in the target: nothing is overwritten. Directories are copied recursively and symbolic links
 * are copied as links.
 *
 * @since 1.0
 */
public final class EnvFileCopier {

  /**
   * Outcome of one copy.
   *
   * @param copied patterns copied
   * @param failed {@code pattern: reason} for each pattern that could not be copied
   */
  public record Result(List<String> copied, List<String> failed) {
    public Result {
      copied = List.copyOf(copied);
      failed = List.copyOf(failed);
    }
  }

  /**
   * Copies every tracked pattern that exists in {@code from} and not yet in {@code to}.
   *
   * @param from source worktree
   * @param to target worktree
   * @param patterns relative paths to copy
   * @return what was copied and what failed
   * @throws IOException if either worktree directory does not exist
   */
  public Result copy(final Path from, final Path to, final List<String> patterns) throws IOException {
    Validate.notNull(from, "from must not be null");
    Validate.notNull(to, "to must not be null");
    Validate.notNull(patterns, "patterns must not be null");
    if (!Files.isDirectory(from)) {
      throw new NoSuchFileException(from.toString(), null, "source worktree does not exist");
    }
    if (!Files.isDirectory(to)) {
      throw new NoSuchFileException(to.toString(), null, "target worktree does not exist");
    }

    final Path fromRoot = from.toAbsolutePath().normalize();
    final Path toRoot = to.toAbsolutePath().normalize();
    final List<String> copied = new ArrayList<>();
    final List<String> failed = new ArrayList<>();
    for (final String pattern : patterns) {
      final Path src = fromRoot.resolve(pattern).normalize();
      final Path dst = toRoot.resolve(pattern).normalize();
      if (!src.startsWith(fromRoot) || !dst.startsWith(toRoot) || src.equals(fromRoot)) {
        failed.add(pattern + ": not inside the worktree");
        continue;
      }
      if (!Files.exists(src, LinkOption.NOFOLLOW_LINKS) || Files.exists(dst, LinkOption.NOFOLLOW_LINKS)) {
        continue;
      }
      try {
        copyTree(src, dst);
        copied.add(pattern);
      } catch (final IOException e) {
        failed.add(pattern + ": " + e.getMessage());
      }
    }
    return new Result(copied, failed);
  }

  private static void copyTree(final Path src, final Path dst) throws IOException {
    if (dst.getParent() != null) {
      Files.createDirectories(dst.getParent());
    }
    if (!Files.isDirectory(src, LinkOption.NOFOLLOW_LINKS)) {
      Files.copy(src, dst, StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
      return;
    }
    Files.walkFileTree(src, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
        Files.createDirectories(dst.resolve(src.relativize(dir)));
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) throws IOException {
        Files.copy(file, dst.resolve(src.relativize(file)), StandardCopyOption.COPY_ATTRIBUTES,
            LinkOption.NOFOLLOW_LINKS);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
