package com.gentoro.specminer.pipeline;

/**
 * A file that contributed no records because processing it failed.
 *
 * @param file corpus-qualified relative path, e.g. {@code public/petstore.yaml}
 * @param kind where the failure happened
 * @param reason short, single-line description
 */
public record FileFailure(String file, Kind kind, String reason) {

  public enum Kind {
    /** The document could not be read or parsed. */
    PARSE,
    /** The document parsed but an extractor failed on it. */
    EXTRACTION
  }
}
