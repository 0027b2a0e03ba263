/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector;

/**
 * Severity of a detected anomaly or change point, derived from the absolute magnitude of the relative deviation.
 * Declared in increasing order of severity.
 */
public enum Severity {
  LOW("low", 0.0), MEDIUM("medium", 25.0), HIGH("high", 50.0), CRITICAL("critical", 100.0);

  private final String _value;
  private final double _minPercent;

  Severity(String value, double minPercent) {
    _value = value;
    _minPercent = minPercent;
  }

  /**
   * @return Smallest absolute percentage that maps to this severity.
   */
  public double minPercent() {
    return _minPercent;
  }

  /**
   * Map a percentage to its severity. The sign of the percentage is ignored.
   *
   * @param percent Deviation or change in percent.
   * @return The severity for the absolute magnitude of the given percentage.
   */
  public static Severity forPercent(double percent) {
    double magnitude = Math.abs(percent);
    if (magnitude >= CRITICAL._minPercent) {
      return CRITICAL;
    } else if (magnitude >= HIGH._minPercent) {
      return HIGH;
    } else if (magnitude >= MEDIUM._minPercent) {
      return MEDIUM;
    }
    return LOW;
  }

  @Override
  public String toString() {
    return _value;
  }
}
