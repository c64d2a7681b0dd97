package com.gentoro.specminer.model;

import java.util.List;

/** Three disjoint partitions of a deduplicated dataset. */
public record DatasetSplit(
    List<DatasetRecord> train, List<DatasetRecord> val, List<DatasetRecord> test) {

  public DatasetSplit {
    train = List.copyOf(train);
    val = List.copyOf(val);
    test = List.copyOf(test);
  }

  public int size() {
    return train.size() + val.size() + test.size();
  }
}
