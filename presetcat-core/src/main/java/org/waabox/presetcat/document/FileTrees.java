package org.waabox.presetcat.document;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Recursive file tree helpers shared by the mutation layer and the sync
 * engine.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileTrees {

  /** The git metadata entry, skipped when restoring files. */
  private static final String GIT_ENTRY = ".git";

  private FileTrees() {
  }

  /**
   * Deletes a file or a directory with everything below it. Does nothing
   * if the path does not exist.
   *
   * @param root the path to delete, never null
   *
   * @throws IOException if any entry cannot be deleted
   */
  public static void delete(final Path root) throws IOException {
    Objects.requireNonNull(root, "root must not be null");
    if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(final Path file,
          final BasicFileAttributes attrs) throws IOException {
        file.toFile().setWritable(true);
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(final Path dir,
          final IOException exc) throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }

  /**
   * Copies a directory tree into a target directory, which is created if
   * needed. Existing files in the target are replaced.
   *
   * @param source the directory to copy, never null
   * @param target the destination directory, never null
   *
   * @throws IOException if any entry cannot be copied
   */
  public static void copy(final Path source, final Path target)
      throws IOException {
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(target, "target must not be null");
    Files.walkFileTree(source, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(final Path dir,
          final BasicFileAttributes attrs) throws IOException {
        Files.createDirectories(target.resolve(source.relativize(dir)));
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(final Path file,
          final BasicFileAttributes attrs) throws IOException {
        Files.copy(file, target.resolve(source.relativize(file)),
            StandardCopyOption.REPLACE_EXISTING);
        return FileVisitResult.CONTINUE;
      }
    });
  }

  /**
   * Copies into the target every file of the source that the target does
   * not have. Files already present in the target are left untouched and
   * {@code .git} entries are skipped at every level.
   *
   * @param source the directory holding the files to restore, never null
   * @param target the directory to restore into, never null
   *
   * @return the number of files restored
   *
   * @throws IOException if any entry cannot be copied
   */
  public static int restoreMissing(final Path source, final Path target)
      throws IOException {
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(target, "target must not be null");
    final int[] restored = {0};
    Files.walkFileTree(source, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(final Path dir,
          final BasicFileAttributes attrs) throws IOException {
        if (GIT_ENTRY.equals(fileName(dir)) && !dir.equals(source)) {
          return FileVisitResult.SKIP_SUBTREE;
        }
        Files.createDirectories(target.resolve(source.relativize(dir)));
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(final Path file,
          final BasicFileAttributes attrs) throws IOException {
        if (GIT_ENTRY.equals(fileName(file))) {
          return FileVisitResult.CONTINUE;
        }
        final Path destination = target.resolve(source.relativize(file));
        if (!Files.exists(destination)) {
          Files.copy(file, destination);
          restored[0]++;
        }
        return FileVisitResult.CONTINUE;
      }
    });
    return restored[0];
  }

  private static String fileName(final Path path) {
    final Path name = path.getFileName();
    return name == null ? "" : name.toString();
  }
}
