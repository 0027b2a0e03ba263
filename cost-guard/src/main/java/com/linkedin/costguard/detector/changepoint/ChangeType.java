/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

/**
 * Direction of a change point.
 */
public enum ChangeType {
  INCREASE("increase"), DECREASE("decrease");

  private final String _value;

  ChangeType(String value) {
    _value = value;
  }

  /**
   * @param beforeMean Mean before the change point.
   * @param afterMean Mean after the change point.
   * @return {@link #INCREASE} if the mean went up, {@link #DECREASE} otherwise.
   */
  public static ChangeType of(double beforeMean, double afterMean) {
    return afterMean > beforeMean ? INCREASE : DECREASE;
  }

  @Override
  public String toString() {
    return _value;
  }
}
