package com.gentoro.specminer.dataset;

import com.gentoro.specminer.model.DatasetRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops records whose {@code input_text} was already seen. The first occurrence wins regardless of
 * its target or type, and kept records stay in encounter order.
 */
public class Deduplicator {

  public List<DatasetRecord> dedupe(List<DatasetRecord> records) {
    Set<String> seen = new HashSet<>();
    List<DatasetRecord> kept = new ArrayList<>(records.size());
    for (DatasetRecord record : records) {
      if (seen.add(record.inputText())) {
        kept.add(record);
      }
    }
    return kept;
  }
}
