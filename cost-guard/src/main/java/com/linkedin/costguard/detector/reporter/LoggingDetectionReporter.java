/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import com.linkedin.costguard.exception.InsufficientDataException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The default reporter. Writes every finding to the log.
 */
public class LoggingDetectionReporter implements DetectionReporter {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingDetectionReporter.class);

  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public void onAnomalyAlert(AnomalyAlert alert) {
    LOG.info("Anomaly detected: {} [Severity: {}, Confidence: {}, Dimensions: {}]", alert.message(), alert.severity(),
             String.format("%.2f", alert.confidence()), alert.dimensions());
  }

  @Override
  public void onChangePoint(ChangePointEvent event) {
    LOG.info("Change point detected at {} by {} segmentation: {}", event.timestamp(), event.method(), event.message());
  }

  @Override
  public void onHighConfidenceEvent(HighConfidenceEvent event) {
    LOG.info("{} (change point at {})", event.message(), event.changePoint().timestamp());
  }

  @Override
  public void onInsufficientData(String detector, InsufficientDataException cause) {
    LOG.info("No {} detection: {}", detector, cause.getMessage());
  }
}
