/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.baseline;

import java.time.LocalDate;


public final class ForecastPoint {
  private final LocalDate _timestamp;
  private final double _forecast;

  ForecastPoint(LocalDate timestamp, double forecast) {
    _timestamp = timestamp;
    _forecast = forecast;
  }

  public LocalDate timestamp() {
    return _timestamp;
  }

  public double forecast() {
    return _forecast;
  }

  @Override
  public String toString() {
    return String.format("{%s: %.2f}", _timestamp, _forecast);
  }
}
