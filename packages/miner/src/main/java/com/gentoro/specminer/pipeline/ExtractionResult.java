package com.gentoro.specminer.pipeline;

import com.gentoro.specminer.model.DatasetRecord;
import java.util.List;

/**
 * Everything one extraction pass produced.
 *
 * @param records accumulated records in canonical file order, before deduplication
 * @param processedFiles candidate files visited
 * @param parseFailures files that could not be parsed
 * @param skippedFiles files dropped because extraction failed
 * @param nonMappingRoots files that parsed to something other than a Mapping
 * @param failures one entry per parse failure or skipped file
 */
public record ExtractionResult(
    List<DatasetRecord> records,
    int processedFiles,
    int parseFailures,
    int skippedFiles,
    int nonMappingRoots,
    List<FileFailure> failures) {

  public ExtractionResult {
    records = List.copyOf(records);
    failures = List.copyOf(failures);
  }
}
