package com.gentoro.specminer.dataset;

import com.gentoro.specminer.exception.EmptyCorpusException;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.DatasetSplit;
import com.gentoro.specminer.model.DatasetSummary;
import com.gentoro.specminer.model.MinedDataset;
import com.gentoro.specminer.pipeline.ExtractionResult;
import java.util.List;
import java.util.Map;

/** Turns accumulated records into the final dataset: dedupe, split, summarize. */
public class DatasetAssembler {

  private final Deduplicator deduplicator;
  private final Splitter splitter;
  private final SummaryReporter reporter;

  public DatasetAssembler(Splitter splitter) {
    this(new Deduplicator(), splitter, new SummaryReporter());
  }

  public DatasetAssembler(Deduplicator deduplicator, Splitter splitter, SummaryReporter reporter) {
    this.deduplicator = deduplicator;
    this.splitter = splitter;
    this.reporter = reporter;
  }

  /**
   * @throws EmptyCorpusException when no record survives deduplication
   */
  public MinedDataset assemble(ExtractionResult result) {
    List<DatasetRecord> unique = deduplicator.dedupe(result.records());
    if (unique.isEmpty()) {
      throw new EmptyCorpusException(
          "No valid records extracted from the corpus; check the root directory and corpora",
          Map.of(
              "processedFiles", result.processedFiles(),
              "parseFailures", result.parseFailures(),
              "skippedFiles", result.skippedFiles()));
    }
    DatasetSplit split = splitter.split(unique);
    DatasetSummary summary = reporter.summarize(unique, split);
    reporter.log(result, summary);
    return new MinedDataset(unique, split, summary);
  }
}
