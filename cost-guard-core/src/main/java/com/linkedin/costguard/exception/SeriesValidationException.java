/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.exception;

/**
 * Thrown if the input series does not carry a field that the requested detection relies on, e.g. the value field
 * or the dimension key used for partitioning.
 */
public class SeriesValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;
  private final String _field;

  public SeriesValidationException(String field, String message) {
    super(message);
    _field = field;
  }

  /**
   * @return Name of the offending field.
   */
  public String field() {
    return _field;
  }
}
