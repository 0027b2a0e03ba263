/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.statistics;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;


/**
 * Summary statistics of a contiguous slice {@code [from, to)} of a series of values. The standard deviation is the
 * population standard deviation of the slice.
 */
public final class SliceStatistics {
  private static final double MEDIAN_PERCENTILE = 50.0;
  private final int _count;
  private final double _mean;
  private final double _median;
  private final double _stdDev;
  private final double _min;
  private final double _max;
  private final double _sum;

  private SliceStatistics(DescriptiveStatistics stats) {
    _count = (int) stats.getN();
    _mean = stats.getMean();
    _median = stats.getPercentile(MEDIAN_PERCENTILE);
    _stdDev = Math.sqrt(stats.getPopulationVariance());
    _min = stats.getMin();
    _max = stats.getMax();
    _sum = stats.getSum();
  }

  /**
   * @param values Values of the series.
   * @param from Index of the first value of the slice (inclusive).
   * @param to Index after the last value of the slice (exclusive).
   * @return Statistics of the given slice.
   */
  public static SliceStatistics of(double[] values, int from, int to) {
    if (from < 0 || to > values.length || from >= to) {
      throw new IllegalArgumentException(String.format("Invalid slice [%d, %d) of a series with %d values.",
                                                       from, to, values.length));
    }
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int i = from; i < to; i++) {
      stats.addValue(values[i]);
    }
    return new SliceStatistics(stats);
  }

  /**
   * Mean of the values in {@code [from, to)}, with the bounds clipped to the series.
   *
   * @param values Values of the series.
   * @param from Index of the first value (inclusive), may be negative.
   * @param to Index after the last value (exclusive), may exceed the length of the series.
   * @return The mean of the clipped slice, or {@code 0} if the clipped slice is empty.
   */
  public static double clippedMean(double[] values, int from, int to) {
    int start = Math.max(0, from);
    int end = Math.min(values.length, to);
    if (start >= end) {
      return 0.0;
    }
    double sum = 0.0;
    for (int i = start; i < end; i++) {
      sum += values[i];
    }
    return sum / (end - start);
  }

  public int count() {
    return _count;
  }

  public double mean() {
    return _mean;
  }

  public double median() {
    return _median;
  }

  public double stdDev() {
    return _stdDev;
  }

  public double min() {
    return _min;
  }

  public double max() {
    return _max;
  }

  public double sum() {
    return _sum;
  }
}
