package com.gentoro.specminer.utility;

import com.gentoro.specminer.exception.IoException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class FileUtility {

  /** Callback that writes the full content of a file. */
  @FunctionalInterface
  public interface ContentWriter {
    void write(BufferedWriter writer) throws IOException;
  }

  public static void ensureDirectory(Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new IoException("Failed to create directory: " + dir, e);
    }
  }

  /**
   * Writes UTF-8 content to a temporary sibling of {@code target} and moves it into place, so
   * readers never observe a half-written file.
   */
  public static void writeAtomically(Path target, ContentWriter content) {
    Path dir = target.toAbsolutePath().getParent();
    ensureDirectory(dir);
    Path tmp = null;
    try {
      tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
      try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        content.write(writer);
      }
      try {
        Files.move(
            tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new IoException("Failed to write file: " + target, e);
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) return;
    try {
      Files.deleteIfExists(path);
    } catch (IOException ignored) {
      // the write failure is what gets reported
    }
  }
}
