package com.gentoro.specminer.dataset;

import com.gentoro.specminer.exception.ConfigException;

/** Train/val/test shares of a dataset. Each is non-negative and together they sum to 1. */
public record SplitRatios(double train, double val, double test) {

  public static final SplitRatios DEFAULT = new SplitRatios(0.8, 0.1, 0.1);

  private static final double TOLERANCE = 1e-6;

  public SplitRatios {
    if (train < 0 || val < 0 || test < 0) {
      throw new ConfigException(
          "Split ratios must be non-negative: train=%s val=%s test=%s".formatted(train, val, test));
    }
    if (Math.abs(train + val + test - 1.0) > TOLERANCE) {
      throw new ConfigException(
          "Split ratios must sum to 1: train=%s val=%s test=%s".formatted(train, val, test));
    }
  }

  /** Share of the records held out from training. */
  public double heldOut() {
    return val + test;
  }

  /** Share of the held-out records that goes to test. */
  public double testShareOfHeldOut() {
    return heldOut() == 0 ? 0 : test / heldOut();
  }
}
