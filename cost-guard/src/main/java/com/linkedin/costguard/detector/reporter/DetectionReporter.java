/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.linkedin.costguard.common.CostGuardConfigurable;
import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import com.linkedin.costguard.exception.InsufficientDataException;


/**
 * The reporter is notified of everything the detectors find. Detectors call it synchronously, in detection order,
 * from the thread that runs the detection; implementations used with parallel group detection must be thread safe.
 */
public interface DetectionReporter extends CostGuardConfigurable {

  /**
   * When a baseline anomaly is detected.
   *
   * @param alert The detected anomaly.
   */
  void onAnomalyAlert(AnomalyAlert alert);

  /**
   * When a change point is detected.
   *
   * @param event The detected change point.
   */
  void onChangePoint(ChangePointEvent event);

  /**
   * When a baseline anomaly is confirmed by a nearby change point.
   *
   * @param event The high-confidence event.
   */
  void onHighConfidenceEvent(HighConfidenceEvent event);

  /**
   * When a detector did not run because the series was too short.
   *
   * @param detector Name of the detector.
   * @param cause Details of the shortfall.
   */
  void onInsufficientData(String detector, InsufficientDataException cause);
}
