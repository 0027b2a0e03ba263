/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;

/**
 * Utils class for Cost Guard
 */
public final class CostGuardUtils {
  private CostGuardUtils() {

  }

  /**
   * Ensure that the given String value of the given String key is not {@code null} or empty.
   *
   * @param key The key corresponding to the given String value.
   * @param value String value to be checked for being non-empty.
   */
  public static void ensureValidString(String key, String value) {
    validateNotNull(value, () -> key + " cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " cannot be empty");
    }
  }

  /**
   * Relative change from the given base to the given value, in percent. A base that is zero or negative has no
   * meaningful relative change, so the change is reported as {@code 0}.
   *
   * @param base The reference value, e.g. the baseline mean.
   * @param value The observed value.
   * @return {@code (value - base) / base * 100}, or {@code 0} if {@code base <= 0}.
   */
  public static double percentChange(double base, double value) {
    if (base <= 0.0) {
      return 0.0;
    }
    return (value - base) / base * 100.0;
  }

  /**
   * @param first A date.
   * @param second Another date.
   * @return The absolute number of days between the given dates.
   */
  public static long absoluteDaysBetween(LocalDate first, LocalDate second) {
    return Math.abs(ChronoUnit.DAYS.between(first, second));
  }

  /**
   * Capitalize the first letter of the given metric name, e.g. {@code cost -> Cost}.
   *
   * @param name Metric name.
   * @return The capitalized name.
   */
  public static String capitalize(String name) {
    if (name == null || name.isEmpty()) {
      return name;
    }
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
