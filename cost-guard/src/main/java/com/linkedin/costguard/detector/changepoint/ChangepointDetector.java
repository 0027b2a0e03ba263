/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.CostGuardUtils;
import com.linkedin.costguard.common.config.ConfigException;
import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.detector.DetectionResult;
import com.linkedin.costguard.detector.Severity;
import com.linkedin.costguard.detector.reporter.DetectionReporter;
import com.linkedin.costguard.exception.CostGuardException;
import com.linkedin.costguard.exception.DependencyUnavailableException;
import com.linkedin.costguard.exception.InsufficientDataException;
import com.linkedin.costguard.model.TimeSeries;
import com.linkedin.costguard.statistics.SliceStatistics;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * Detects persistent shifts in the level of a series.
 *
 * <p>Segment boundaries are located by the {@link SegmentationStrategy} named by
 * {@link CostGuardConfig#CHANGEPOINT_SEGMENTATION_CLASS_CONFIG}. If that strategy cannot be loaded, or refuses or
 * fails to segment a series, the strategy named by {@link CostGuardConfig#CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_CONFIG}
 * is used for that series instead. Every boundary becomes a {@link ChangePointEvent} that compares the mean of up to
 * {@link CostGuardConfig#CHANGEPOINT_CONTEXT_POINTS_CONFIG} points on either side of it.
 */
public class ChangepointDetector {
  private static final Logger LOG = LoggerFactory.getLogger(ChangepointDetector.class);
  public static final String NAME = "changepoint";
  private final int _minSegmentLength;
  private final int _contextPoints;
  private final SegmentationStrategy _primary;
  private final SegmentationStrategy _fallback;
  private final DetectionReporter _reporter;

  public ChangepointDetector(CostGuardConfig config) {
    this(config, config.detectionReporter());
  }

  public ChangepointDetector(CostGuardConfig config, DetectionReporter reporter) {
    validateNotNull(config, "Config cannot be null.");
    _minSegmentLength = config.getInt(CostGuardConfig.CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG);
    _contextPoints = config.getInt(CostGuardConfig.CHANGEPOINT_CONTEXT_POINTS_CONFIG);
    _reporter = validateNotNull(reporter, "Detection reporter cannot be null.");
    _primary = loadPrimaryStrategy(config);
    try {
      _fallback = config.getConfiguredInstance(CostGuardConfig.CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_CONFIG,
                                               SegmentationStrategy.class);
    } catch (ClassNotFoundException | CostGuardException e) {
      throw new ConfigException(CostGuardConfig.CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_CONFIG,
                                config.getString(CostGuardConfig.CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_CONFIG),
                                "Cannot instantiate the fallback segmentation strategy.", e);
    }
  }

  private static SegmentationStrategy loadPrimaryStrategy(CostGuardConfig config) {
    String strategyClass = config.getString(CostGuardConfig.CHANGEPOINT_SEGMENTATION_CLASS_CONFIG);
    try {
      return config.getConfiguredInstance(CostGuardConfig.CHANGEPOINT_SEGMENTATION_CLASS_CONFIG, SegmentationStrategy.class);
    } catch (ClassNotFoundException | CostGuardException | RuntimeException e) {
      LOG.warn("Segmentation strategy {} is unavailable, change points will be located by the fallback strategy.",
               strategyClass, e);
      return null;
    }
  }

  /**
   * @return The primary segmentation strategy, or empty if it could not be loaded.
   */
  public Optional<SegmentationStrategy> primaryStrategy() {
    return Optional.ofNullable(_primary);
  }

  public SegmentationStrategy fallbackStrategy() {
    return _fallback;
  }

  /**
   * Detect change points in the given value field of the given series.
   *
   * @param series The series to analyze.
   * @param valueField Name of the value field, e.g. {@code cost}.
   * @return The change points in index order, or an empty result flagged as insufficient if the series has fewer than
   * twice the minimum segment length points.
   */
  public DetectionResult<ChangePointEvent> detect(TimeSeries series, String valueField) {
    validateNotNull(series, "Series cannot be null.");
    series.ensureValueField(valueField);
    int requiredPoints = 2 * _minSegmentLength;
    if (series.size() < requiredPoints) {
      InsufficientDataException ide = new InsufficientDataException(series.size(), requiredPoints);
      LOG.warn("Cannot run {} detection on {}: {}", NAME, valueField, ide.getMessage());
      _reporter.onInsufficientData(NAME, ide);
      return DetectionResult.insufficient(ide);
    }

    double[] values = series.values(valueField);
    SegmentationStrategy strategy = _primary;
    List<Integer> breaks = null;
    if (_primary != null) {
      try {
        breaks = _primary.breaks(values);
      } catch (DependencyUnavailableException | RuntimeException e) {
        LOG.warn("{} segmentation failed on {} points of {}, using {} segmentation: {}", _primary.name(), values.length,
                 valueField, _fallback.name(), e.getMessage());
      }
    }
    if (breaks == null) {
      strategy = _fallback;
      try {
        breaks = _fallback.breaks(values);
      } catch (DependencyUnavailableException e) {
        LOG.error("{} segmentation failed on {} points of {}, no change points can be located.", _fallback.name(),
                  values.length, valueField, e);
        return DetectionResult.of(Collections.emptyList());
      }
    }

    List<ChangePointEvent> events = new ArrayList<>();
    for (int index : breaks) {
      if (index <= 0 || index >= values.length) {
        continue;
      }
      ChangePointEvent event = toEvent(series, values, index, valueField, strategy.name());
      events.add(event);
      _reporter.onChangePoint(event);
    }
    return DetectionResult.of(events);
  }

  /**
   * Summarize the segments that the given change points split the series into.
   *
   * @param series The series to analyze.
   * @param changeIndices Indices of the first point of every segment but the first, e.g. the indices of detected
   *                      change points. Duplicates, {@code 0} and the series length are ignored.
   * @param valueField Name of the value field.
   * @return One segment per slice between consecutive change points, in series order.
   */
  public List<Segment> analyzeSegments(TimeSeries series, Collection<Integer> changeIndices, String valueField) {
    validateNotNull(series, "Series cannot be null.");
    validateNotNull(changeIndices, "Change indices cannot be null.");
    series.ensureValueField(valueField);
    int n = series.size();
    TreeSet<Integer> bounds = new TreeSet<>();
    for (int index : changeIndices) {
      if (index < 0 || index > n) {
        throw new IllegalArgumentException(String.format("Change index %d is out of the range [0, %d].", index, n));
      }
      bounds.add(index);
    }
    bounds.add(0);
    bounds.add(n);

    double[] values = series.values(valueField);
    List<Segment> segments = new ArrayList<>(bounds.size() - 1);
    Integer start = bounds.first();
    for (Integer end = bounds.higher(start); end != null; start = end, end = bounds.higher(end)) {
      segments.add(new Segment(segments.size() + 1, series.get(start).timestamp(), series.get(end - 1).timestamp(),
                               SliceStatistics.of(values, start, end)));
    }
    return segments;
  }

  private ChangePointEvent toEvent(TimeSeries series, double[] values, int index, String valueField, String method) {
    double beforeMean = SliceStatistics.clippedMean(values, index - _contextPoints, index);
    double afterMean = SliceStatistics.clippedMean(values, index, index + _contextPoints);
    double changePercent = CostGuardUtils.percentChange(beforeMean, afterMean);
    String message = String.format(Locale.ROOT, "%s pattern shift detected: %+.1f%% change ($%.2f -> $%.2f)",
                                   CostGuardUtils.capitalize(valueField), changePercent, beforeMean, afterMean);
    return new ChangePointEvent(series.get(index).timestamp(), index, beforeMean, afterMean, changePercent,
                                ChangeType.of(beforeMean, afterMean), Severity.forPercent(changePercent), method, message);
  }
}
