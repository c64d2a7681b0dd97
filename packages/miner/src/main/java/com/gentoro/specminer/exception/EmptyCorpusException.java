package com.gentoro.specminer.exception;

import java.util.Map;

/**
 * No record survived extraction and deduplication. The dataset cannot be partitioned, so the run
 * stops before any output file is written.
 */
public class EmptyCorpusException extends SpecMinerException {
  public EmptyCorpusException(String message, Map<String, ?> context) {
    super(SpecMinerErrorCode.EMPTY_CORPUS, message, context);
  }
}
