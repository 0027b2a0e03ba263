/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.ensemble;

import com.linkedin.costguard.CostGuardUtils;
import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.detector.DetectionResult;
import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.baseline.BaselineDetector;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.changepoint.ChangepointDetector;
import com.linkedin.costguard.detector.reporter.DetectionReporter;
import com.linkedin.costguard.model.TimeSeries;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * Runs the {@link BaselineDetector} and the {@link ChangepointDetector} over the same series and correlates their
 * findings. A baseline anomaly that has a change point within {@link CostGuardConfig#ENSEMBLE_CORRELATION_WINDOW_DAYS_CONFIG}
 * days of it becomes a {@link HighConfidenceEvent}. Each anomaly is paired with at most one change point: the first
 * one in index order that is close enough.
 */
public class EnsembleDetector {
  private static final Logger LOG = LoggerFactory.getLogger(EnsembleDetector.class);
  private final BaselineDetector _baselineDetector;
  private final ChangepointDetector _changepointDetector;
  private final int _correlationWindowDays;
  private final int _minGroupPoints;
  private final int _minDetectorsAgreement;
  private final DetectionReporter _reporter;

  public EnsembleDetector(CostGuardConfig config) {
    this(config, config.detectionReporter());
  }

  public EnsembleDetector(CostGuardConfig config, DetectionReporter reporter) {
    this(config, new BaselineDetector(config, reporter), new ChangepointDetector(config, reporter), reporter);
  }

  EnsembleDetector(CostGuardConfig config,
                   BaselineDetector baselineDetector,
                   ChangepointDetector changepointDetector,
                   DetectionReporter reporter) {
    validateNotNull(config, "Config cannot be null.");
    _baselineDetector = validateNotNull(baselineDetector, "Baseline detector cannot be null.");
    _changepointDetector = validateNotNull(changepointDetector, "Changepoint detector cannot be null.");
    _reporter = validateNotNull(reporter, "Detection reporter cannot be null.");
    _correlationWindowDays = config.getInt(CostGuardConfig.ENSEMBLE_CORRELATION_WINDOW_DAYS_CONFIG);
    _minGroupPoints = config.getInt(CostGuardConfig.ENSEMBLE_MIN_GROUP_POINTS_CONFIG);
    _minDetectorsAgreement = config.getInt(CostGuardConfig.ENSEMBLE_MIN_DETECTORS_AGREEMENT_CONFIG);
  }

  public BaselineDetector baselineDetector() {
    return _baselineDetector;
  }

  public ChangepointDetector changepointDetector() {
    return _changepointDetector;
  }

  /**
   * @return The configured minimum number of agreeing detectors. Correlation always pairs both detectors, so this
   * value does not affect detection yet.
   */
  public int minDetectorsAgreement() {
    return _minDetectorsAgreement;
  }

  /**
   * Run both detectors over the given value field of the given series and correlate their findings.
   *
   * @param series The series to analyze.
   * @param valueField Name of the value field, e.g. {@code cost}.
   * @return The findings of both detectors and the high-confidence events among them.
   */
  public EnsembleResult detect(TimeSeries series, String valueField) {
    DetectionResult<AnomalyAlert> anomalies = _baselineDetector.detect(series, valueField);
    DetectionResult<ChangePointEvent> changePoints = _changepointDetector.detect(series, valueField);
    List<HighConfidenceEvent> highConfidenceEvents = correlate(anomalies, changePoints);
    EnsembleResult result = new EnsembleResult(anomalies, changePoints, highConfidenceEvents);
    LOG.info("Ensemble detection complete: {} baseline anomalies, {} change points, {} high-confidence events",
             result.totalAnomalies(), result.totalChangePoints(), result.highConfidenceCount());
    return result;
  }

  /**
   * Run {@link #detect(TimeSeries, String)} separately on every partition of the series by the given key. Partitions
   * with fewer than {@link CostGuardConfig#ENSEMBLE_MIN_GROUP_POINTS_CONFIG} points are left out.
   *
   * @param series The series to analyze.
   * @param groupKey Dimension key to group by, e.g. {@code service}.
   * @param valueField Name of the value field.
   * @return Results by group value, sorted by group value.
   */
  public SortedMap<String, EnsembleResult> detectByGroup(TimeSeries series, String groupKey, String valueField) {
    validateNotNull(series, "Series cannot be null.");
    SortedMap<String, EnsembleResult> resultsByGroup = new TreeMap<>();
    for (Map.Entry<String, TimeSeries> entry : eligibleGroups(series, groupKey).entrySet()) {
      resultsByGroup.put(entry.getKey(), detect(entry.getValue(), valueField));
      LOG.info("Completed detection for {}={}", groupKey, entry.getKey());
    }
    return resultsByGroup;
  }

  /**
   * Same as {@link #detectByGroup(TimeSeries, String, String)}, but the groups are analyzed in parallel by the given
   * executor. The result does not depend on the order in which the groups complete. The configured reporter is called
   * from the executor threads.
   *
   * @param series The series to analyze.
   * @param groupKey Dimension key to group by.
   * @param valueField Name of the value field.
   * @param executor Executor that runs the detection of each group.
   * @return Results by group value, sorted by group value.
   * @throws InterruptedException If interrupted while waiting for a group to complete.
   */
  public SortedMap<String, EnsembleResult> detectByGroup(TimeSeries series,
                                                         String groupKey,
                                                         String valueField,
                                                         ExecutorService executor) throws InterruptedException {
    validateNotNull(series, "Series cannot be null.");
    validateNotNull(executor, "Executor cannot be null.");
    SortedMap<String, Future<EnsembleResult>> pending = new TreeMap<>();
    for (Map.Entry<String, TimeSeries> entry : eligibleGroups(series, groupKey).entrySet()) {
      TimeSeries group = entry.getValue();
      pending.put(entry.getKey(), executor.submit(() -> detect(group, valueField)));
    }

    SortedMap<String, EnsembleResult> resultsByGroup = new TreeMap<>();
    for (Map.Entry<String, Future<EnsembleResult>> entry : pending.entrySet()) {
      try {
        resultsByGroup.put(entry.getKey(), entry.getValue().get());
      } catch (ExecutionException e) {
        pending.values().forEach(future -> future.cancel(true));
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        throw new IllegalStateException(String.format("Detection failed for %s=%s", groupKey, entry.getKey()), cause);
      }
    }
    return resultsByGroup;
  }

  private SortedMap<String, TimeSeries> eligibleGroups(TimeSeries series, String groupKey) {
    SortedMap<String, TimeSeries> groups = new TreeMap<>();
    for (Map.Entry<String, TimeSeries> entry : series.partitionBy(groupKey).entrySet()) {
      if (entry.getValue().size() >= _minGroupPoints) {
        groups.put(entry.getKey(), entry.getValue());
      } else {
        LOG.debug("Skipping {}={} with {} points.", groupKey, entry.getKey(), entry.getValue().size());
      }
    }
    return groups;
  }

  private List<HighConfidenceEvent> correlate(DetectionResult<AnomalyAlert> anomalies,
                                              DetectionResult<ChangePointEvent> changePoints) {
    List<HighConfidenceEvent> highConfidenceEvents = new ArrayList<>();
    for (AnomalyAlert alert : anomalies) {
      for (ChangePointEvent changePoint : changePoints) {
        if (CostGuardUtils.absoluteDaysBetween(alert.timestamp(), changePoint.timestamp()) <= _correlationWindowDays) {
          HighConfidenceEvent event = new HighConfidenceEvent(alert, changePoint);
          highConfidenceEvents.add(event);
          _reporter.onHighConfidenceEvent(event);
          break;
        }
      }
    }
    return highConfidenceEvents;
  }
}
