/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;


/**
 * Named sensitivity of the baseline envelope. Each level maps to the number of standard deviations a value must
 * be away from the rolling mean to be flagged.
 */
public enum Sensitivity {
  LOW(4.0), MEDIUM(3.0), HIGH(2.0), VERY_HIGH(1.5);

  private static final List<Sensitivity> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final double _stdDevMultiplier;

  Sensitivity(double stdDevMultiplier) {
    _stdDevMultiplier = stdDevMultiplier;
  }

  public double stdDevMultiplier() {
    return _stdDevMultiplier;
  }

  /**
   * @return The configuration name of this level, e.g. {@code very_high}.
   */
  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param configName Configuration name, e.g. {@code medium} (case insensitive).
   * @return The matching sensitivity.
   * @throws IllegalArgumentException If the name matches no level.
   */
  public static Sensitivity forConfigName(String configName) {
    for (Sensitivity sensitivity : CACHED_VALUES) {
      if (sensitivity.configName().equalsIgnoreCase(configName.trim())) {
        return sensitivity;
      }
    }
    throw new IllegalArgumentException("Unknown sensitivity " + configName);
  }

  /**
   * @return Configuration names of all levels, in increasing order of sensitivity.
   */
  public static String[] configNames() {
    return CACHED_VALUES.stream().map(Sensitivity::configName).toArray(String[]::new);
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<Sensitivity> cachedValues() {
    return CACHED_VALUES;
  }
}
