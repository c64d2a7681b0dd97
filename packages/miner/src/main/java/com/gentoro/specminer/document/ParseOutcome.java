package com.gentoro.specminer.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;

/**
 * Result of loading one file: either a document tree or the reason it could not be parsed.
 *
 * @param fileName name used when reporting the outcome
 * @param document parsed root; the missing node when parsing failed or the file was empty
 * @param failureReason null on success
 */
public record ParseOutcome(String fileName, JsonNode document, String failureReason) {

  public ParseOutcome {
    Objects.requireNonNull(fileName, "fileName");
    document = document == null ? MissingNode.getInstance() : document;
  }

  public static ParseOutcome success(String fileName, JsonNode document) {
    return new ParseOutcome(fileName, document, null);
  }

  public static ParseOutcome failure(String fileName, String reason) {
    return new ParseOutcome(
        fileName, MissingNode.getInstance(), reason == null || reason.isBlank() ? "unknown" : reason);
  }

  public boolean isFailure() {
    return failureReason != null;
  }

  /** Only documents with a Mapping root can contribute records. */
  public boolean hasMappingRoot() {
    return !isFailure() && SafeNavigator.isMapping(document);
  }
}
