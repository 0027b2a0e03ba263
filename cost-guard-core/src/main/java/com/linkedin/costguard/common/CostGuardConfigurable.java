/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.costguard.common;

import java.util.Map;


/**
 * A Mix-in style interface for pluggable classes (e.g. segmentation strategies, detection reporters) that are
 * instantiated by reflection and need to take configuration parameters.
 */
public interface CostGuardConfigurable {

  /**
   * Configure this class with the given key-value pairs. Called once, right after instantiation.
   *
   * @param configs The original configuration, including keys this class does not know.
   */
  void configure(Map<String, ?> configs);
}
