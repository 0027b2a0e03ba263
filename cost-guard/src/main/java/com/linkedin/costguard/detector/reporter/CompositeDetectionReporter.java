/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import com.linkedin.costguard.exception.InsufficientDataException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;


/**
 * Fans every notification out to a fixed list of reporters, in list order.
 */
public class CompositeDetectionReporter implements DetectionReporter {
  private final List<DetectionReporter> _reporters;

  public CompositeDetectionReporter(List<DetectionReporter> reporters) {
    _reporters = Collections.unmodifiableList(new ArrayList<>(reporters));
  }

  public CompositeDetectionReporter(DetectionReporter... reporters) {
    this(Arrays.asList(reporters));
  }

  public List<DetectionReporter> reporters() {
    return _reporters;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    _reporters.forEach(reporter -> reporter.configure(configs));
  }

  @Override
  public void onAnomalyAlert(AnomalyAlert alert) {
    _reporters.forEach(reporter -> reporter.onAnomalyAlert(alert));
  }

  @Override
  public void onChangePoint(ChangePointEvent event) {
    _reporters.forEach(reporter -> reporter.onChangePoint(event));
  }

  @Override
  public void onHighConfidenceEvent(HighConfidenceEvent event) {
    _reporters.forEach(reporter -> reporter.onHighConfidenceEvent(event));
  }

  @Override
  public void onInsufficientData(String detector, InsufficientDataException cause) {
    _reporters.forEach(reporter -> reporter.onInsufficientData(detector, cause));
  }
}
