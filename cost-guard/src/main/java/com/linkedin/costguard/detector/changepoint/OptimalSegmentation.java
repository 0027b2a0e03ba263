/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.exception.DependencyUnavailableException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.rank.Median;


/**
 * Exact penalized segmentation under a least-squares cost.
 *
 * <p>Finds the segmentation that minimizes the sum over segments of the squared deviations from the segment mean,
 * measured in units of the noise variance of the series, plus {@link CostGuardConfig#CHANGEPOINT_PENALTY_CONFIG} per
 * change point, with every segment at least {@link CostGuardConfig#CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG} points long.
 * The noise standard deviation is estimated from the median absolute day-over-day difference, and is never taken
 * below {@link #MIN_RELATIVE_NOISE} of the mean absolute value. Scaling a series by a positive factor therefore does
 * not change its segmentation. The solver is the classic dynamic program over segment end points, using prefix sums to
 * compute the cost of a segment in constant time. It runs in quadratic time and linear space, so series longer than
 * {@link CostGuardConfig#CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_CONFIG} are refused.
 */
public class OptimalSegmentation implements SegmentationStrategy {
  public static final String NAME = "optimal";
  static final double MIN_RELATIVE_NOISE = 0.01;
  // Ratio of the standard deviation of a normal distribution to its median absolute deviation.
  private static final double MAD_TO_STD_DEV = 1.4826;
  private int _minSegmentLength;
  private double _penalty;
  private int _maxSeriesLength;

  @Override
  public void configure(Map<String, ?> configs) {
    CostGuardConfig config = new CostGuardConfig(configs, false);
    _minSegmentLength = config.getInt(CostGuardConfig.CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG);
    _penalty = config.getDouble(CostGuardConfig.CHANGEPOINT_PENALTY_CONFIG);
    _maxSeriesLength = config.getInt(CostGuardConfig.CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_CONFIG);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Integer> breaks(double[] values) throws DependencyUnavailableException {
    int n = values.length;
    if (n > _maxSeriesLength) {
      throw new DependencyUnavailableException(String.format("Series of %d points exceeds the maximum of %d points for "
                                                             + "optimal segmentation.", n, _maxSeriesLength));
    }
    if (n < 2 * _minSegmentLength) {
      return Collections.singletonList(n);
    }
    double noiseStdDev = noiseStdDev(values);
    if (noiseStdDev == 0.0) {
      // Every value is zero.
      return Collections.singletonList(n);
    }
    // Scaling the penalty by the noise variance is the same as normalizing every segment cost by it.
    double penalty = _penalty * noiseStdDev * noiseStdDev;

    double[] sum = new double[n + 1];
    double[] sumOfSquares = new double[n + 1];
    for (int i = 0; i < n; i++) {
      sum[i + 1] = sum[i] + values[i];
      sumOfSquares[i + 1] = sumOfSquares[i] + values[i] * values[i];
    }

    // bestCost[j] is the optimal penalized cost of values[0, j); lastStart[j] is where its last segment starts.
    double[] bestCost = new double[n + 1];
    int[] lastStart = new int[n + 1];
    bestCost[0] = -penalty;
    for (int end = 1; end <= n; end++) {
      bestCost[end] = Double.POSITIVE_INFINITY;
      if (end < _minSegmentLength) {
        continue;
      }
      // A single segment starting at 0 is tried first so that ties keep the segmentation with fewer change points.
      bestCost[end] = bestCost[0] + segmentCost(sum, sumOfSquares, 0, end) + penalty;
      lastStart[end] = 0;
      for (int start = _minSegmentLength; start <= end - _minSegmentLength; start++) {
        double cost = bestCost[start] + segmentCost(sum, sumOfSquares, start, end) + penalty;
        if (cost < bestCost[end]) {
          bestCost[end] = cost;
          lastStart[end] = start;
        }
      }
    }

    List<Integer> breaks = new ArrayList<>();
    for (int end = n; end > 0; end = lastStart[end]) {
      breaks.add(end);
    }
    Collections.reverse(breaks);
    return breaks;
  }

  /**
   * @return A robust estimate of the standard deviation of the noise around the level of the given values, at least
   * {@link #MIN_RELATIVE_NOISE} of their mean absolute value.
   */
  static double noiseStdDev(double[] values) {
    double[] absoluteDiffs = new double[values.length - 1];
    double absoluteSum = Math.abs(values[0]);
    for (int i = 1; i < values.length; i++) {
      absoluteDiffs[i - 1] = Math.abs(values[i] - values[i - 1]);
      absoluteSum += Math.abs(values[i]);
    }
    // The difference of two independent noise terms has twice their variance.
    double estimate = MAD_TO_STD_DEV * new Median().evaluate(absoluteDiffs) / Math.sqrt(2.0);
    return Math.max(estimate, MIN_RELATIVE_NOISE * absoluteSum / values.length);
  }

  /**
   * @return The sum of squared deviations from the mean of values[start, end).
   */
  private static double segmentCost(double[] sum, double[] sumOfSquares, int start, int end) {
    double segmentSum = sum[end] - sum[start];
    double cost = sumOfSquares[end] - sumOfSquares[start] - segmentSum * segmentSum / (end - start);
    return Math.max(0.0, cost);
  }
}
