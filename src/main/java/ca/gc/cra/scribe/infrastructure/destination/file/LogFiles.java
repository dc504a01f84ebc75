package ca.gc.cra.scribe.infrastructure.destination.file;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** File helpers shared by the plain-text and JSON-lines destinations. */
final class LogFiles {
  private LogFiles() {
    // Utility
  }

  /**
   * Creates the parent directory and, unless appending, truncates the file.
   *
   * @param file target file
   * @param append {@code true} to keep existing content
   * @return the file
   * @throws UncheckedIOException if the directory or file cannot be prepared
   */
  static Path prepare(Path file, boolean append) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (append) {
        if (!Files.exists(file)) {
          Files.createFile(file);
        }
      } else {
        Files.write(file, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
      }
      return file;
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to prepare log file " + file, ex);
    }
  }

  /**
   * Appends one line (plus line separator) to the file.
   *
   * @param file existing file whose parent directory must exist
   * @param line text to append
   * @throws IOException if the file cannot be opened or written
   */
  static void appendLine(Path file, String line) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
      writer.write(line);
      writer.newLine();
    }
  }
}
