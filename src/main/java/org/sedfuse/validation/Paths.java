package org.sedfuse.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the SEDFUSE CLI.
 * <p><strong>Why:</strong> Rejects missing input catalogs and populated result directories before a batch
 * run starts, so a half-written SED table never silently replaces an older one.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} for output directories.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} names an existing readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return real path of the file
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path real = realPath(name, path);
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException(name + " must be a regular file: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }

  /**
   * Validates that {@code path} names an existing readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path real = realPath(name, path);
    if (!Files.isDirectory(real)) {
      throw new IllegalArgumentException(name + " must be a directory: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }

  /**
   * Validates a writable output directory, optionally creating it when missing.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected to avoid overwriting
   * @return canonical directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the directory is not writable, populated, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      Path parent = nearestExistingAncestor(normalized);
      if (!Files.isDirectory(parent) || !Files.isWritable(parent)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parent);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        return normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path realPath(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    try {
      return path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " does not exist: " + path, ex);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start.getParent();
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
