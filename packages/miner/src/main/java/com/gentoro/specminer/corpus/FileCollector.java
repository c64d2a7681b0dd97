package com.gentoro.specminer.corpus;

import com.gentoro.specminer.exception.IoException;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Enumerates candidate documents under a fixed allowlist of corpus directories.
 *
 * <p>Corpora are visited in configured order and files within a corpus are sorted by relative
 * path, so the same tree always yields the same sequence. Symbolic links to files are followed,
 * links to directories are not descended into. A corpus directory that does not exist is logged
 * and skipped.
 */
public class FileCollector {
  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(FileCollector.class);

  static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");

  private final Path rootDir;
  private final List<String> corpora;

  public FileCollector(Path rootDir, List<String> corpora) {
    this.rootDir = rootDir;
    this.corpora = List.copyOf(corpora);
  }

  public List<CorpusFile> collect() {
    List<CorpusFile> files = new ArrayList<>();
    for (String corpus : corpora) {
      Path corpusDir = rootDir.resolve(corpus);
      if (!Files.isDirectory(corpusDir)) {
        log.warn("Corpus directory not found: {}", corpusDir);
        continue;
      }
      List<CorpusFile> found = walk(corpus, corpusDir);
      log.info("Corpus '{}': {} candidate files", corpus, found.size());
      files.addAll(found);
    }
    return files;
  }

  private List<CorpusFile> walk(String corpus, Path corpusDir) {
    List<CorpusFile> found = new ArrayList<>();
    try {
      Files.walkFileTree(
          corpusDir,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              // attrs describe a symlink itself; a link to a regular file is a candidate too
              if (Files.isRegularFile(file) && isCandidate(file.getFileName().toString())) {
                found.add(new CorpusFile(corpus, file, relativize(corpusDir, file)));
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              log.warn("Cannot read {}: {}", file, exc.getMessage());
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      throw new IoException("Failed to walk corpus directory: " + corpusDir, e);
    }
    found.sort(Comparator.comparing(CorpusFile::relativePath));
    return found;
  }

  static boolean isCandidate(String fileName) {
    for (String extension : EXTENSIONS) {
      if (fileName.endsWith(extension)) {
        return true;
      }
    }
    return false;
  }

  private static String relativize(Path base, Path file) {
    return base.relativize(file).toString().replace('\\', '/');
  }
}
