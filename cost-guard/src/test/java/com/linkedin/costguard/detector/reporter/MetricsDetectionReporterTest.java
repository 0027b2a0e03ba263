/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.detector.Severity;
import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.ensemble.EnsembleDetector;
import com.linkedin.costguard.detector.ensemble.EnsembleResult;
import org.junit.Test;

import static com.linkedin.costguard.CostGuardTestUtils.COST;
import static com.linkedin.costguard.CostGuardTestUtils.config;
import static com.linkedin.costguard.CostGuardTestUtils.dailyCosts;
import static com.linkedin.costguard.CostGuardTestUtils.levelShift;
import static com.linkedin.costguard.CostGuardTestUtils.spikeBeforeShift;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;


public class MetricsDetectionReporterTest {

  private static long count(MetricRegistry registry, String name) {
    return registry.meter(MetricRegistry.name(MetricsDetectionReporter.METRIC_GROUP, name)).getCount();
  }

  @Test
  public void testMeters() {
    MetricRegistry registry = new MetricRegistry();
    MetricsDetectionReporter reporter = new MetricsDetectionReporter(registry);
    EnsembleResult result = new EnsembleDetector(config(), reporter).detect(dailyCosts(spikeBeforeShift()), COST);
    new EnsembleDetector(config(), reporter).detect(dailyCosts(1.0, 2.0), COST);

    long critical = result.baselineAnomalies().items().stream().filter(a -> a.severity() == Severity.CRITICAL).count();
    assertEquals(critical, count(registry, "critical-anomaly-rate"));
    long anomalies = 0;
    for (Severity severity : Severity.values()) {
      anomalies += count(registry, severity + "-anomaly-rate");
    }
    assertEquals(result.totalAnomalies(), anomalies);
    assertEquals(1L, count(registry, "change-point-rate"));
    assertEquals(0L, count(registry, "fallback-change-point-rate"));
    assertEquals(result.highConfidenceCount(), count(registry, "high-confidence-anomaly-rate"));
    assertEquals(2L, count(registry, "insufficient-data-rate"));
  }

  @Test
  public void testFallbackChangePoints() {
    MetricRegistry registry = new MetricRegistry();
    new EnsembleDetector(config(CostGuardConfig.CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_CONFIG, "10"),
                         new MetricsDetectionReporter(registry))
        .detect(dailyCosts(levelShift()), COST);
    long fallback = count(registry, "fallback-change-point-rate");
    assertEquals(5L, fallback);
    assertEquals(fallback, count(registry, "change-point-rate"));
  }

  @Test
  public void testConfiguredByClassNameUsesSharedRegistry() {
    SharedMetricRegistries.remove(MetricsDetectionReporter.REGISTRY_NAME);
    try {
      CostGuardConfig config = config(CostGuardConfig.DETECTION_REPORTER_CLASS_CONFIG, MetricsDetectionReporter.class.getName());
      EnsembleResult result = new EnsembleDetector(config).detect(dailyCosts(levelShift()), COST);

      MetricRegistry registry = SharedMetricRegistries.getOrCreate(MetricsDetectionReporter.REGISTRY_NAME);
      long alerts = 0;
      for (AnomalyAlert alert : result.baselineAnomalies()) {
        alerts += alert.severity() == Severity.CRITICAL ? 1 : 0;
      }
      assertTrue(alerts > 0);
      assertEquals(alerts, count(registry, "critical-anomaly-rate"));
      assertEquals(1L, count(registry, "change-point-rate"));
      assertEquals(result.highConfidenceCount(), count(registry, "high-confidence-anomaly-rate"));
      assertSame(registry, ((MetricsDetectionReporter) config.detectionReporter()).registry());
    } finally {
      SharedMetricRegistries.remove(MetricsDetectionReporter.REGISTRY_NAME);
    }
  }
}
