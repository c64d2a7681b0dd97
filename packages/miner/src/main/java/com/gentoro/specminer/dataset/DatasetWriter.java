package com.gentoro.specminer.dataset;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.MinedDataset;
import com.gentoro.specminer.utility.FileUtility;
import com.gentoro.specminer.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists a dataset as JSON-lines split files plus a pretty-printed summary.
 *
 * <p>Each line of a split file is one record with the fields {@code source_file, type,
 * input_text, target_text}, UTF-8 encoded with non-ASCII characters kept as-is.
 */
public class DatasetWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(DatasetWriter.class);

  public static final String TRAIN_FILE = "train.json";
  public static final String VAL_FILE = "val.json";
  public static final String TEST_FILE = "test.json";
  public static final String SUMMARY_FILE = "dataset_summary.json";

  private final Path outputDir;

  public DatasetWriter(Path outputDir) {
    this.outputDir = outputDir;
  }

  public void write(MinedDataset dataset) {
    FileUtility.ensureDirectory(outputDir);
    writeLines(outputDir.resolve(TRAIN_FILE), dataset.split().train());
    writeLines(outputDir.resolve(VAL_FILE), dataset.split().val());
    writeLines(outputDir.resolve(TEST_FILE), dataset.split().test());

    Path summaryFile = outputDir.resolve(SUMMARY_FILE);
    FileUtility.writeAtomically(
        summaryFile,
        writer -> {
          writer.write(JacksonUtility.toJson(dataset.summary()));
          writer.write('\n');
        });
    log.info("Wrote dataset to {}", outputDir.toAbsolutePath());
  }

  private void writeLines(Path file, List<DatasetRecord> records) {
    ObjectWriter jsonLines = JacksonUtility.getJsonLinesWriter();
    FileUtility.writeAtomically(
        file,
        writer -> {
          for (DatasetRecord record : records) {
            writer.write(jsonLines.writeValueAsString(record));
            writer.write('\n');
          }
        });
    log.info("{}: {} records", file.getFileName(), records.size());
  }
}
