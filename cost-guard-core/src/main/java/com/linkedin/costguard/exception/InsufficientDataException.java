/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.exception;

/**
 * The exception indicates that a series (or a partition of it) does not have enough points for a detector to run.
 * Detectors recover from it by returning an empty result that is flagged as insufficient.
 */
public class InsufficientDataException extends CostGuardException {
  private final int _available;
  private final int _required;

  public InsufficientDataException(int available, int required) {
    super(String.format("Insufficient data points: %d < %d", available, required));
    _available = available;
    _required = required;
  }

  public int available() {
    return _available;
  }

  public int required() {
    return _required;
  }
}
