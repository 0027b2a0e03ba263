/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.detector.Severity;
import java.time.LocalDate;
import java.util.Objects;


/**
 * A structural shift in the level of a series. The index is the position of the first point of the new regime.
 */
public final class ChangePointEvent {
  private final LocalDate _timestamp;
  private final int _index;
  private final double _beforeMean;
  private final double _afterMean;
  private final double _changePercent;
  private final ChangeType _changeType;
  private final Severity _severity;
  private final String _method;
  private final String _message;

  ChangePointEvent(LocalDate timestamp,
                   int index,
                   double beforeMean,
                   double afterMean,
                   double changePercent,
                   ChangeType changeType,
                   Severity severity,
                   String method,
                   String message) {
    _timestamp = timestamp;
    _index = index;
    _beforeMean = beforeMean;
    _afterMean = afterMean;
    _changePercent = changePercent;
    _changeType = changeType;
    _severity = severity;
    _method = method;
    _message = message;
  }

  public LocalDate timestamp() {
    return _timestamp;
  }

  public int index() {
    return _index;
  }

  public double beforeMean() {
    return _beforeMean;
  }

  public double afterMean() {
    return _afterMean;
  }

  public double changePercent() {
    return _changePercent;
  }

  public ChangeType changeType() {
    return _changeType;
  }

  public Severity severity() {
    return _severity;
  }

  /**
   * @return Name of the segmentation strategy that located the change point.
   */
  public String method() {
    return _method;
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
    ChangePointEvent that = (ChangePointEvent) o;
    return _index == that._index
           && Double.compare(that._beforeMean, _beforeMean) == 0
           && Double.compare(that._afterMean, _afterMean) == 0
           && _timestamp.equals(that._timestamp)
           && _method.equals(that._method);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestamp, _index, _beforeMean, _afterMean, _method);
  }

  @Override
  public String toString() {
    return String.format("{%s (index %d) %s: %s}", _timestamp, _index, _severity, _message);
  }
}
