package com.gentoro.specminer.model;

import java.util.List;

/**
 * The finished dataset of one run.
 *
 * @param records deduplicated records in encounter order
 * @param split train/val/test partitions of {@code records}
 * @param summary statistics over {@code records} and {@code split}
 */
public record MinedDataset(List<DatasetRecord> records, DatasetSplit split, DatasetSummary summary) {

  public MinedDataset {
    records = List.copyOf(records);
  }
}
