package com.gentoro.specminer.corpus;

import java.nio.file.Path;

/**
 * A candidate document found under one of the configured corpora.
 *
 * @param corpus name of the corpus directory the file was found in
 * @param path full path to the file
 * @param relativePath path relative to the corpus directory, with '/' separators
 */
public record CorpusFile(String corpus, Path path, String relativePath) {

  /** Bare file name; this is the provenance recorded on mined records. */
  public String fileName() {
    return path.getFileName().toString();
  }
}
