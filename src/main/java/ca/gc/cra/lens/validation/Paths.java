package ca.gc.cra.lens.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Up-front filesystem checks so a bad {@code in}, {@code patterns} or {@code out} fails before any export is
 * parsed.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {}

  /**
   * Requires an existing, readable regular file.
   *
   * @param name setting name used in messages
   * @param path candidate file
   * @return absolute, normalized path
   * @throws IllegalArgumentException when the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path file = absolute(name, path);
    String problem = !Files.exists(file) ? "does not exist"
        : !Files.isRegularFile(file) ? "is not a regular file"
        : !Files.isReadable(file) ? "is not readable"
        : null;
    if (problem != null) {
      throw new IllegalArgumentException(name + " " + problem + ": " + file);
    }
    return file;
  }

  /**
   * Requires that {@code path} is, or can become, a writable directory.
   *
   * <p>With {@code create} unset (dry runs) nothing is written: a missing directory passes when its nearest
   * existing ancestor is a writable directory.
   *
   * @param path candidate output directory
   * @param create whether to create the directory and its parents
   * @return real path when the directory exists afterwards, otherwise the normalized path
   * @throws IllegalArgumentException when the path, or the ancestor that would hold it, is not a writable
   *     directory
   */
  public static Path requireWritableDirectory(Path path, boolean create) {
    Path dir = absolute("out", path);
    try {
      if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
        if (!create) {
          checkDirectory(existingAncestor(dir));
          return dir;
        }
        Files.createDirectories(dir);
      }
      Path real = dir.toRealPath();
      checkDirectory(real);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("cannot use " + dir + " as output directory: " + ex.getMessage(), ex);
    }
  }

  private static Path absolute(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (path.toString().chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static void checkDirectory(Path dir) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
  }

  private static Path existingAncestor(Path dir) throws IOException {
    for (Path parent = dir.getParent(); parent != null; parent = parent.getParent()) {
      if (Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        return parent.toRealPath();
      }
    }
    throw new IllegalArgumentException("no existing ancestor for " + dir);
  }
}
