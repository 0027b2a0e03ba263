/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import com.linkedin.costguard.exception.InsufficientDataException;
import java.util.Map;


/**
 * A no-op reporter.
 */
public class NoopDetectionReporter implements DetectionReporter {

  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public void onAnomalyAlert(AnomalyAlert alert) {

  }

  @Override
  public void onChangePoint(ChangePointEvent event) {

  }

  @Override
  public void onHighConfidenceEvent(HighConfidenceEvent event) {

  }

  @Override
  public void onInsufficientData(String detector, InsufficientDataException cause) {

  }
}
