/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.exception;

/**
 * Thrown when a pluggable backend (e.g. the optimal segmentation solver) cannot be used for the current input.
 * Callers are expected to substitute a fallback instead of propagating it.
 */
public class DependencyUnavailableException extends CostGuardException {
  public DependencyUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public DependencyUnavailableException(String message) {
    super(message);
  }
}
