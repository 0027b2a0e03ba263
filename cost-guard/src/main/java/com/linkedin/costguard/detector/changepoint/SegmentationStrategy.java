/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.common.CostGuardConfigurable;
import com.linkedin.costguard.exception.DependencyUnavailableException;
import java.util.List;


/**
 * Splits a series of values into segments of homogeneous level.
 *
 * <p>Implementations are instantiated by class name through a public no-argument constructor and configured with
 * the original Cost Guard configuration before use. They must not keep state across calls to {@link #breaks(double[])}.
 */
public interface SegmentationStrategy extends CostGuardConfigurable {

  /**
   * @return Short name of the strategy, recorded on every change point it locates.
   */
  String name();

  /**
   * Locate the segment boundaries of the given values.
   *
   * @param values Values of the series, in timestamp order.
   * @return Ascending end indices (exclusive) of every segment. The last element is always {@code values.length}, so a
   * series without change points yields {@code [values.length]}.
   * @throws DependencyUnavailableException If this strategy cannot segment the given values.
   */
  List<Integer> breaks(double[] values) throws DependencyUnavailableException;
}
