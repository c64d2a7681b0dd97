package com.gentoro.specminer.dataset;

import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.DatasetSplit;
import com.gentoro.specminer.model.DatasetSummary;
import com.gentoro.specminer.pipeline.ExtractionResult;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Aggregate counts of a run, persisted next to the split files. */
public class SummaryReporter {
  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(SummaryReporter.class);

  /**
   * @param dataset the full deduplicated dataset, before splitting
   * @param split the partitions of {@code dataset}
   */
  public DatasetSummary summarize(List<DatasetRecord> dataset, DatasetSplit split) {
    return new DatasetSummary(
        dataset.size(),
        split.train().size(),
        split.val().size(),
        split.test().size(),
        typeBreakdown(dataset));
  }

  /** Count per record type, largest first; equal counts are ordered by type name. */
  static Map<String, Integer> typeBreakdown(List<DatasetRecord> records) {
    Map<String, Integer> counts = new TreeMap<>();
    for (DatasetRecord record : records) {
      counts.merge(record.type().wireName(), 1, Integer::sum);
    }
    Map<String, Integer> ordered = new LinkedHashMap<>();
    counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .forEachOrdered(e -> ordered.put(e.getKey(), e.getValue()));
    return ordered;
  }

  public void log(ExtractionResult result, DatasetSummary summary) {
    log.info(
        "Processed {} files: {} parse failures, {} skipped on extraction errors",
        result.processedFiles(),
        result.parseFailures(),
        result.skippedFiles());
    log.info(
        "Extracted {} records, {} unique after deduplication",
        result.records().size(),
        summary.totalExamples());
    summary.typeBreakdown().forEach((type, count) -> log.info("  {}: {}", type, count));
    log.info(
        "Split sizes: train={} val={} test={}",
        summary.trainSize(),
        summary.valSize(),
        summary.testSize());
  }
}
