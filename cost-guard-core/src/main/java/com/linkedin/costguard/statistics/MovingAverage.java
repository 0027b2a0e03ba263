/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;


/**
 * Trailing moving averages. The average at index {@code i} covers the values in
 * {@code [i - window + 1, i]}, clipped at the start of the series.
 */
public final class MovingAverage {

  private MovingAverage() {

  }

  /**
   * @param values Values of the series.
   * @param window Number of trailing values covered by each average.
   * @param minPeriods Minimum number of values required for an average to be defined.
   * @return For each index, the trailing average, or empty if fewer than {@code minPeriods} values are available.
   */
  public static List<OptionalDouble> trailing(double[] values, int window, int minPeriods) {
    if (window < 1 || minPeriods < 1 || minPeriods > window) {
      throw new IllegalArgumentException(String.format("Invalid window %d with min periods %d.", window, minPeriods));
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(window);
    List<OptionalDouble> averages = new ArrayList<>(values.length);
    for (double value : values) {
      stats.addValue(value);
      averages.add(stats.getN() >= minPeriods ? OptionalDouble.of(stats.getMean()) : OptionalDouble.empty());
    }
    return averages;
  }
}
