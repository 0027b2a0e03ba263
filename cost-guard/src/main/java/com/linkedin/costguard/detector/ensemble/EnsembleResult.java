/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.ensemble;

import com.linkedin.costguard.detector.DetectionResult;
import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * The combined outcome of an ensemble run over one series.
 */
public final class EnsembleResult {
  private final DetectionResult<AnomalyAlert> _baselineAnomalies;
  private final DetectionResult<ChangePointEvent> _changePointEvents;
  private final List<HighConfidenceEvent> _highConfidenceEvents;

  EnsembleResult(DetectionResult<AnomalyAlert> baselineAnomalies,
                 DetectionResult<ChangePointEvent> changePointEvents,
                 List<HighConfidenceEvent> highConfidenceEvents) {
    _baselineAnomalies = baselineAnomalies;
    _changePointEvents = changePointEvents;
    _highConfidenceEvents = Collections.unmodifiableList(new ArrayList<>(highConfidenceEvents));
  }

  public DetectionResult<AnomalyAlert> baselineAnomalies() {
    return _baselineAnomalies;
  }

  public DetectionResult<ChangePointEvent> changePointEvents() {
    return _changePointEvents;
  }

  public List<HighConfidenceEvent> highConfidenceEvents() {
    return _highConfidenceEvents;
  }

  public int totalAnomalies() {
    return _baselineAnomalies.size();
  }

  public int totalChangePoints() {
    return _changePointEvents.size();
  }

  public int highConfidenceCount() {
    return _highConfidenceEvents.size();
  }

  @Override
  public String toString() {
    return String.format("EnsembleResult{anomalies=%d, changePoints=%d, highConfidence=%d}", totalAnomalies(),
                         totalChangePoints(), highConfidenceCount());
  }
}
