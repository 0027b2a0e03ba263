/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.statistics.SliceStatistics;
import java.time.LocalDate;


/**
 * Summary of the points between two consecutive change points.
 */
public final class Segment {
  private final int _segmentNumber;
  private final LocalDate _startTimestamp;
  private final LocalDate _endTimestamp;
  private final SliceStatistics _statistics;

  Segment(int segmentNumber, LocalDate startTimestamp, LocalDate endTimestamp, SliceStatistics statistics) {
    _segmentNumber = segmentNumber;
    _startTimestamp = startTimestamp;
    _endTimestamp = endTimestamp;
    _statistics = statistics;
  }

  /**
   * @return 1-based position of this segment in the series.
   */
  public int segmentNumber() {
    return _segmentNumber;
  }

  public LocalDate startTimestamp() {
    return _startTimestamp;
  }

  /**
   * @return Timestamp of the last point of this segment.
   */
  public LocalDate endTimestamp() {
    return _endTimestamp;
  }

  public double mean() {
    return _statistics.mean();
  }

  public double median() {
    return _statistics.median();
  }

  public double stdDev() {
    return _statistics.stdDev();
  }

  public double min() {
    return _statistics.min();
  }

  public double max() {
    return _statistics.max();
  }

  public double sum() {
    return _statistics.sum();
  }

  public int count() {
    return _statistics.count();
  }

  @Override
  public String toString() {
    return String.format("{segment %d [%s, %s] mean=%.2f, count=%d}", _segmentNumber, _startTimestamp, _endTimestamp,
                         mean(), count());
  }
}
