package com.gentoro.specminer.pipeline;

import com.gentoro.specminer.corpus.CorpusFile;
import com.gentoro.specminer.corpus.FileCollector;
import com.gentoro.specminer.document.DocumentParser;
import com.gentoro.specminer.document.ParseOutcome;
import com.gentoro.specminer.exception.ExceptionUtil;
import com.gentoro.specminer.exception.SpecMinerErrorCode;
import com.gentoro.specminer.exception.SpecMinerException;
import com.gentoro.specminer.extraction.RecordExtractor;
import com.gentoro.specminer.model.DatasetRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects corpus files, parses each one and runs the enabled extractors over it.
 *
 * <p>Files are isolated from each other: a file that fails to parse, or whose extraction throws,
 * contributes nothing and is recorded in the result, and the run moves on. A file's records are
 * only accumulated once every extractor has finished on it. With {@code parallelism > 1} files are
 * processed on a worker pool, but results are accumulated in collection order, so the output is
 * identical to a sequential run.
 */
public class ExtractionPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(ExtractionPipeline.class);

  private static final int MAX_REASON_LENGTH = 200;

  private final FileCollector collector;
  private final DocumentParser parser;
  private final List<RecordExtractor> extractors;
  private final int parallelism;

  public ExtractionPipeline(
      FileCollector collector,
      DocumentParser parser,
      List<RecordExtractor> extractors,
      int parallelism) {
    this.collector = collector;
    this.parser = parser;
    this.extractors = List.copyOf(extractors);
    this.parallelism = Math.max(1, parallelism);
  }

  public ExtractionResult run() {
    List<CorpusFile> files = collector.collect();
    log.info(
        "Extracting from {} files with {} (parallelism={})",
        files.size(),
        extractors.stream().map(e -> e.capability().configName()).toList(),
        parallelism);

    List<FileOutcome> outcomes =
        parallelism == 1 || files.size() < 2 ? processSequentially(files) : processInParallel(files);

    List<DatasetRecord> records = new ArrayList<>();
    List<FileFailure> failures = new ArrayList<>();
    int parseFailures = 0;
    int skipped = 0;
    int nonMappingRoots = 0;
    for (FileOutcome outcome : outcomes) {
      records.addAll(outcome.records());
      if (outcome.failure() != null) {
        failures.add(outcome.failure());
        if (outcome.failure().kind() == FileFailure.Kind.PARSE) {
          parseFailures++;
        } else {
          skipped++;
        }
      }
      if (outcome.nonMappingRoot()) {
        nonMappingRoots++;
      }
    }
    return new ExtractionResult(
        records, files.size(), parseFailures, skipped, nonMappingRoots, failures);
  }

  private List<FileOutcome> processSequentially(List<CorpusFile> files) {
    List<FileOutcome> outcomes = new ArrayList<>(files.size());
    for (CorpusFile file : files) {
      outcomes.add(process(file));
    }
    return outcomes;
  }

  private List<FileOutcome> processInParallel(List<CorpusFile> files) {
    AtomicInteger threadCounter = new AtomicInteger();
    ExecutorService executor =
        Executors.newFixedThreadPool(
            parallelism,
            r -> {
              Thread t = new Thread(r, "specminer-worker-" + threadCounter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    try {
      List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
      for (CorpusFile file : files) {
        futures.add(executor.submit(() -> process(file)));
      }
      List<FileOutcome> outcomes = new ArrayList<>(files.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(futures.get(i), files.get(i)));
      }
      return outcomes;
    } finally {
      executor.shutdownNow();
    }
  }

  private FileOutcome await(Future<FileOutcome> future, CorpusFile file) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SpecMinerException(SpecMinerErrorCode.CANCELLED, "Extraction interrupted", e);
    } catch (ExecutionException e) {
      // process() handles exceptions itself; only errors such as StackOverflowError end up here
      return extractionFailure(file, e.getCause());
    }
  }

  /** Parses and extracts one file. Never throws for problems confined to that file. */
  FileOutcome process(CorpusFile file) {
    String displayName = file.corpus() + "/" + file.relativePath();
    ParseOutcome parsed = parser.parse(file.path());
    if (parsed.isFailure()) {
      return new FileOutcome(
          List.of(),
          new FileFailure(displayName, FileFailure.Kind.PARSE, parsed.failureReason()),
          false);
    }
    if (!parsed.hasMappingRoot()) {
      log.debug("Ignoring {}: root is {}", displayName, parsed.document().getNodeType());
      return new FileOutcome(List.of(), null, true);
    }

    try {
      List<DatasetRecord> records = new ArrayList<>();
      for (RecordExtractor extractor : extractors) {
        records.addAll(extractor.extract(parsed.document(), file.fileName()));
      }
      log.debug("{}: {} records", displayName, records.size());
      return new FileOutcome(records, null, false);
    } catch (RuntimeException e) {
      return extractionFailure(file, e);
    }
  }

  private FileOutcome extractionFailure(CorpusFile file, Throwable cause) {
    String displayName = file.corpus() + "/" + file.relativePath();
    String reason = ExceptionUtil.shortReason(cause, MAX_REASON_LENGTH);
    log.warn(
        "Error processing {}: {} at {}",
        displayName,
        reason,
        ExceptionUtil.formatCompactStackTrace(cause));
    return new FileOutcome(
        List.of(), new FileFailure(displayName, FileFailure.Kind.EXTRACTION, reason), false);
  }

  record FileOutcome(List<DatasetRecord> records, FileFailure failure, boolean nonMappingRoot) {}
}
