package com.gentoro.specminer.dataset;

import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.DatasetSplit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded two-stage partition of a dataset.
 *
 * <p>Stage one shuffles the records and holds out {@code ceil(N * (val + test))} of them; the rest
 * is train. Stage two shuffles the held-out records with the same seed and gives {@code ceil(M *
 * test / (val + test))} of them to test, the remainder to val. {@link Random} is specified down to
 * its algorithm, so a given seed and input order always produce the same partitions.
 */
public class Splitter {

  // keeps e.g. 10 * 0.2 from rounding up to 3 through floating point noise
  private static final double EPSILON = 1e-9;

  private final long seed;
  private final SplitRatios ratios;

  public Splitter(long seed, SplitRatios ratios) {
    this.seed = seed;
    this.ratios = ratios;
  }

  public DatasetSplit split(List<DatasetRecord> records) {
    List<DatasetRecord> shuffled = shuffle(records);
    int heldOut = share(shuffled.size(), ratios.heldOut());
    List<DatasetRecord> temp = shuffled.subList(0, heldOut);
    List<DatasetRecord> train = shuffled.subList(heldOut, shuffled.size());

    List<DatasetRecord> shuffledTemp = shuffle(temp);
    int testCount = share(shuffledTemp.size(), ratios.testShareOfHeldOut());
    List<DatasetRecord> test = shuffledTemp.subList(0, testCount);
    List<DatasetRecord> val = shuffledTemp.subList(testCount, shuffledTemp.size());

    return new DatasetSplit(train, val, test);
  }

  private List<DatasetRecord> shuffle(List<DatasetRecord> records) {
    List<DatasetRecord> copy = new ArrayList<>(records);
    Collections.shuffle(copy, new Random(seed));
    return copy;
  }

  static int share(int count, double fraction) {
    int n = (int) Math.ceil(count * fraction - EPSILON);
    return Math.max(0, Math.min(count, n));
  }
}
