/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.statistics.MovingAverage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Approximate segmentation that compares a short and a long trailing moving average. A change point is flagged at
 * every index where the short average deviates from the long one by more than the configured threshold, unless the
 * previous change point is within the minimum segment length.
 */
public class DualMovingAverageSegmentation implements SegmentationStrategy {
  private static final Logger LOG = LoggerFactory.getLogger(DualMovingAverageSegmentation.class);
  public static final String NAME = "fallback";
  private int _minSegmentLength;
  private int _shortWindow;
  private int _longWindow;
  private double _threshold;
  private int _minDataPoints;

  @Override
  public void configure(Map<String, ?> configs) {
    CostGuardConfig config = new CostGuardConfig(configs, false);
    _minSegmentLength = config.getInt(CostGuardConfig.CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG);
    _shortWindow = config.getInt(CostGuardConfig.CHANGEPOINT_FALLBACK_SHORT_WINDOW_CONFIG);
    _longWindow = config.getInt(CostGuardConfig.CHANGEPOINT_FALLBACK_LONG_WINDOW_CONFIG);
    _threshold = config.getDouble(CostGuardConfig.CHANGEPOINT_FALLBACK_THRESHOLD_CONFIG);
    _minDataPoints = config.getInt(CostGuardConfig.CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_CONFIG);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Integer> breaks(double[] values) {
    List<Integer> breaks = new ArrayList<>();
    if (values.length < _minDataPoints) {
      LOG.debug("Series of {} points is too short for moving average segmentation (minimum: {}).",
                values.length, _minDataPoints);
      breaks.add(values.length);
      return breaks;
    }

    List<OptionalDouble> shortAverages = MovingAverage.trailing(values, _shortWindow, (_shortWindow + 1) / 2);
    List<OptionalDouble> longAverages = MovingAverage.trailing(values, _longWindow, _minDataPoints);
    int lastBreak = -1;
    for (int i = _shortWindow; i < values.length; i++) {
      OptionalDouble shortAverage = shortAverages.get(i);
      OptionalDouble longAverage = longAverages.get(i);
      if (!shortAverage.isPresent() || !longAverage.isPresent() || longAverage.getAsDouble() <= 0.0) {
        continue;
      }
      double deviation = Math.abs(shortAverage.getAsDouble() - longAverage.getAsDouble()) / longAverage.getAsDouble();
      if (deviation > _threshold && (lastBreak < 0 || i - lastBreak > _minSegmentLength)) {
        LOG.trace("Moving averages diverge by {} at index {}.", deviation, i);
        breaks.add(i);
        lastBreak = i;
      }
    }
    breaks.add(values.length);
    return breaks;
  }
}
