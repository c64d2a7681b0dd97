package com.gentoro.specminer;

import com.gentoro.specminer.exception.ConfigException;
import com.gentoro.specminer.exception.EmptyCorpusException;
import com.gentoro.specminer.model.DatasetSummary;
import com.gentoro.specminer.model.MinedDataset;
import com.gentoro.specminer.utility.StdoutUtility;

public class SpecMinerApp {

  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(SpecMinerApp.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_EMPTY_CORPUS = 1;
  public static final int EXIT_INVALID_ARGUMENTS = 2;
  public static final int EXIT_FAILURE = 3;

  private static final String USAGE =
      """
      Usage: specminer [--mode extract|dry-run|help] [--config-file <location>]
                       [--root-dir <dir>] [--output-dir <dir>] [--extractors <list>]

        --mode         extract (default) writes train/val/test.json and dataset_summary.json;
                       dry-run builds and reports the dataset without writing it
        --config-file  classpath:<resource>, file:<uri> or a path (default classpath:application.yaml)
        --root-dir     directory holding the corpus directories
        --output-dir   directory receiving the dataset files
        --extractors   comma separated subset of operations,examples,schemas
      """;

  public static void main(String[] args) {
    int status = execute(args);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  static int execute(String[] args) {
    SpecMiner app;
    try {
      app = new SpecMiner(args);
    } catch (IllegalArgumentException e) {
      StdoutUtility.printError(e.getMessage(), null);
      StdoutUtility.printNewLine(USAGE);
      return EXIT_INVALID_ARGUMENTS;
    }
    if ("help".equals(app.startupParameters().mode())) {
      StdoutUtility.printNewLine(USAGE);
      return EXIT_OK;
    }

    try {
      app.initialize();
      MinedDataset dataset = app.run();
      DatasetSummary summary = dataset.summary();
      StdoutUtility.printSuccessLine(
          "Dataset ready: %d examples (train=%d, val=%d, test=%d)%s"
              .formatted(
                  summary.totalExamples(),
                  summary.trainSize(),
                  summary.valSize(),
                  summary.testSize(),
                  app.isDryRun() ? ", not written (dry run)" : ""));
      return EXIT_OK;
    } catch (EmptyCorpusException e) {
      log.error("{} {}", e.getMessage(), e.getContext());
      StdoutUtility.printError(e.getMessage(), null);
      return EXIT_EMPTY_CORPUS;
    } catch (ConfigException e) {
      log.error("Invalid configuration", e);
      StdoutUtility.printError(e.getMessage(), null);
      return EXIT_INVALID_ARGUMENTS;
    } catch (Exception e) {
      log.error("Dataset extraction failed", e);
      StdoutUtility.printError("Dataset extraction failed: " + e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }
}
