package ca.gc.cra.scribe.validation;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for log file and database paths supplied to builders.
 * <p><strong>Why:</strong> A bad path should fail when the pipeline is configured, not on the first write.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Observability:</strong> Emits no logs; exception messages include the offending path.</p>
 *
 * @implNote Only the path shape is checked here; directories are created by the destinations themselves.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a path that must name a file.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is blank, contains control characters or has no file name
   */
  public static Path requireLogFile(String name, String raw) {
    if (raw == null) {
      throw new IllegalArgumentException(label(name) + " must not be null");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    if (raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    Path path;
    try {
      path = Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(label(name) + " is not a valid path: " + raw, ex);
    }
    return requireLogFile(name, path);
  }

  /**
   * Validates a path that must name a file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate path
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is {@code null} or has no file name
   */
  public static Path requireLogFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(label(name) + " must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (normalized.getFileName() == null || path.toString().isBlank()) {
      throw new IllegalArgumentException(label(name) + " must name a file: " + path);
    }
    return normalized;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "path" : name;
  }
}
