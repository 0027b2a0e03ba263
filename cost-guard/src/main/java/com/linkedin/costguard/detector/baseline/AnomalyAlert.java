/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.baseline;

import com.linkedin.costguard.detector.Severity;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;


/**
 * A point whose value fell outside the rolling baseline envelope.
 */
public final class AnomalyAlert {
  private final LocalDate _timestamp;
  private final String _metricName;
  private final double _actualValue;
  private final double _expectedValue;
  private final double _deviationPercent;
  private final Severity _severity;
  private final double _confidence;
  private final SortedMap<String, String> _dimensions;
  private final String _message;

  AnomalyAlert(LocalDate timestamp,
               String metricName,
               double actualValue,
               double expectedValue,
               double deviationPercent,
               Severity severity,
               double confidence,
               Map<String, String> dimensions,
               String message) {
    _timestamp = timestamp;
    _metricName = metricName;
    _actualValue = actualValue;
    _expectedValue = expectedValue;
    _deviationPercent = deviationPercent;
    _severity = severity;
    _confidence = confidence;
    _dimensions = Collections.unmodifiableSortedMap(new TreeMap<>(dimensions));
    _message = message;
  }

  public LocalDate timestamp() {
    return _timestamp;
  }

  /**
   * @return Name of the value field the alert was raised on, e.g. {@code cost}.
   */
  public String metricName() {
    return _metricName;
  }

  public double actualValue() {
    return _actualValue;
  }

  /**
   * @return The rolling mean of the baseline window.
   */
  public double expectedValue() {
    return _expectedValue;
  }

  /**
   * @return Signed relative deviation of the actual value from the expected value, in percent.
   */
  public double deviationPercent() {
    return _deviationPercent;
  }

  public Severity severity() {
    return _severity;
  }

  /**
   * @return How far the value went past the breached bound, relative to the width of the envelope, in [0, 1].
   */
  public double confidence() {
    return _confidence;
  }

  /**
   * @return Recognized dimension tags of the record the alert was raised on, sorted by key.
   */
  public SortedMap<String, String> dimensions() {
    return _dimensions;
  }

  public Optional<String> dimension(String key) {
    return Optional.ofNullable(_dimensions.get(key));
  }

  public String message() {
    return _message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnomalyAlert that = (AnomalyAlert) o;
    return Double.compare(that._actualValue, _actualValue) == 0
           && Double.compare(that._expectedValue, _expectedValue) == 0
           && Double.compare(that._confidence, _confidence) == 0
           && _timestamp.equals(that._timestamp)
           && _metricName.equals(that._metricName)
           && _dimensions.equals(that._dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestamp, _metricName, _actualValue, _expectedValue, _confidence, _dimensions);
  }

  @Override
  public String toString() {
    return String.format("{%s %s: %s, confidence=%.2f, dimensions=%s}", _timestamp, _severity, _message, _confidence,
                         _dimensions);
  }
}
