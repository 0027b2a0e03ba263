/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import com.linkedin.costguard.detector.Severity;
import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.changepoint.OptimalSegmentation;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import com.linkedin.costguard.exception.InsufficientDataException;
import java.util.EnumMap;
import java.util.Map;


/**
 * Counts findings in Dropwizard meters. Meters are thread safe, so a single instance can be shared by detections that
 * run in parallel.
 *
 * <p>An instance created through {@link com.linkedin.costguard.config.CostGuardConfig#DETECTION_REPORTER_CLASS_CONFIG}
 * registers its meters in the shared registry named {@link #REGISTRY_NAME}, where they can be read or attached to a
 * metrics reporter with {@code SharedMetricRegistries.getOrCreate(REGISTRY_NAME)}.
 */
public class MetricsDetectionReporter implements DetectionReporter {
  public static final String METRIC_GROUP = "CostGuard";
  public static final String REGISTRY_NAME = "cost-guard";
  private final MetricRegistry _registry;
  private final Map<Severity, Meter> _anomalyRateBySeverity;
  private final Meter _changePointRate;
  private final Meter _fallbackChangePointRate;
  private final Meter _highConfidenceRate;
  private final Meter _insufficientDataRate;

  public MetricsDetectionReporter() {
    this(SharedMetricRegistries.getOrCreate(REGISTRY_NAME));
  }

  public MetricsDetectionReporter(MetricRegistry registry) {
    _registry = registry;
    _anomalyRateBySeverity = new EnumMap<>(Severity.class);
    for (Severity severity : Severity.values()) {
      _anomalyRateBySeverity.put(severity, registry.meter(MetricRegistry.name(METRIC_GROUP, severity + "-anomaly-rate")));
    }
    _changePointRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "change-point-rate"));
    _fallbackChangePointRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "fallback-change-point-rate"));
    _highConfidenceRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "high-confidence-anomaly-rate"));
    _insufficientDataRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "insufficient-data-rate"));
  }

  public MetricRegistry registry() {
    return _registry;
  }

  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public void onAnomalyAlert(AnomalyAlert alert) {
    _anomalyRateBySeverity.get(alert.severity()).mark();
  }

  @Override
  public void onChangePoint(ChangePointEvent event) {
    _changePointRate.mark();
    if (!OptimalSegmentation.NAME.equals(event.method())) {
      _fallbackChangePointRate.mark();
    }
  }

  @Override
  public void onHighConfidenceEvent(HighConfidenceEvent event) {
    _highConfidenceRate.mark();
  }

  @Override
  public void onInsufficientData(String detector, InsufficientDataException cause) {
    _insufficientDataRate.mark();
  }
}
