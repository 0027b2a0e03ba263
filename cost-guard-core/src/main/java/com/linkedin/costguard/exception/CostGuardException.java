/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.exception;

/**
 * The base class of the checked exceptions thrown by Cost Guard. Detectors handle these internally and turn them
 * into empty or fallback results.
 */
public class CostGuardException extends Exception {

  public CostGuardException(String message, Throwable cause) {
    super(message, cause);
  }

  public CostGuardException(String message) {
    super(message);
  }

  public CostGuardException(Throwable cause) {
    super(cause);
  }
}
