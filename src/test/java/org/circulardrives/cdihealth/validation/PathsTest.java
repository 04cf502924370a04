package org.circulardrives.cdihealth.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateOutputFileAcceptsNewFileInExistingDirectory() {
    Path target = tempDir.resolve("sub/../report.json");

    assertEquals(tempDir.resolve("report.json").toAbsolutePath(), Paths.validateOutputFile(target, false));
  }

  @Test
  void validateOutputFileRejectsExistingFileWithoutOverwrite() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("report.json"), "{}");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(existing, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(existing.toAbsolutePath(), Paths.validateOutputFile(existing, true));
  }

  @Test
  void validateOutputFileRejectsDirectoriesAndMissingParents() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir, true));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(tempDir.resolve("missing/report.json"), false));
  }

  @Test
  void validateOutputFileRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(Path.of(tempDir + "/bad\u0007.json"), false));
  }

  @Test
  void requireReadableFileAcceptsRegularFilesOnly() throws IOException {
    Path file = Files.writeString(tempDir.resolve("sda.json"), "{}");

    assertEquals(file.toAbsolutePath(), Paths.requireReadableFile(file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir.resolve("nope.json")));
  }
}
