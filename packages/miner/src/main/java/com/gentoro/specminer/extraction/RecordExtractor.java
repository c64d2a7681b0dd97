package com.gentoro.specminer.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.model.DatasetRecord;
import java.util.List;

/**
 * Mines one record family from a parsed document.
 *
 * <p>Implementations read the tree only through {@link
 * com.gentoro.specminer.document.SafeNavigator}, so any document shape is acceptable input. Only
 * fully built and filtered records are returned.
 */
public interface RecordExtractor {

  ExtractorCapability capability();

  /**
   * @param root document root (any node type)
   * @param sourceFile bare file name recorded as provenance
   * @return records in document order, possibly empty
   */
  List<DatasetRecord> extract(JsonNode root, String sourceFile);
}
