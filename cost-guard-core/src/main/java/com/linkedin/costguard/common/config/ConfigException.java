/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.costguard.common.config;

/**
 * Thrown if a configuration value is missing, malformed, out of range or names a class that cannot be used.
 */
public class ConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String name, Object value, String message) {
    super(invalidValueMessage(name, value, message));
  }

  public ConfigException(String name, Object value, String message, Throwable cause) {
    super(invalidValueMessage(name, value, message), cause);
  }

  private static String invalidValueMessage(String name, Object value, String message) {
    return "Invalid value " + value + " for configuration " + name + (message == null ? "" : ": " + message);
  }
}
