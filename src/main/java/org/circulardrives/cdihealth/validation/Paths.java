package org.circulardrives.cdihealth.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for report outputs and offline telemetry inputs.
 * <p><strong>Why:</strong> Fails fast before a scan spends minutes probing devices only to lose the report.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so symlinked targets are rejected.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a report output file.
   *
   * @param path candidate file; must not be {@code null}
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the parent is missing or not writable, or the file exists and may not be replaced
   */
  public static Path validateOutputFile(Path path, boolean allowOverwrite) {
    Path normalized = checkRaw(path).toAbsolutePath().normalize();
    if (Files.isSymbolicLink(normalized)) {
      throw new IllegalArgumentException("output must not be a symbolic link: " + normalized);
    }
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("output directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("output directory is not writable: " + parent);
    }
    return normalized;
  }

  /**
   * Validates an input file that must exist and be readable.
   *
   * @param path candidate file; must not be {@code null}
   * @return real path of the file
   * @throws IllegalArgumentException if the file is missing, a directory or unreadable
   */
  public static Path requireReadableFile(Path path) {
    Path normalized = checkRaw(path).toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path checkRaw(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path;
  }
}
