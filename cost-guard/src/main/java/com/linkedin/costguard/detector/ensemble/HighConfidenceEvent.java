/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.ensemble;

import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import java.time.LocalDate;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * A baseline anomaly that was confirmed by a change point close to it in time. Both detectors agreeing on the same
 * period makes the anomaly far less likely to be noise.
 */
public final class HighConfidenceEvent {
  public static final String TYPE = "high_confidence_anomaly";
  private static final String MESSAGE_PREFIX = "High-confidence anomaly: Detected by both baseline and changepoint methods. ";
  private final AnomalyAlert _alert;
  private final ChangePointEvent _changePoint;

  HighConfidenceEvent(AnomalyAlert alert, ChangePointEvent changePoint) {
    _alert = validateNotNull(alert, "Anomaly alert cannot be null.");
    _changePoint = validateNotNull(changePoint, "Change point cannot be null.");
  }

  public AnomalyAlert alert() {
    return _alert;
  }

  public ChangePointEvent changePoint() {
    return _changePoint;
  }

  /**
   * @return Timestamp of the baseline anomaly.
   */
  public LocalDate timestamp() {
    return _alert.timestamp();
  }

  public String message() {
    return MESSAGE_PREFIX + _alert.message();
  }

  @Override
  public String toString() {
    return String.format("{%s: %s, change point at %s}", timestamp(), message(), _changePoint.timestamp());
  }
}
