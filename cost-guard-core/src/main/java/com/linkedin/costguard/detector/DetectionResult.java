/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector;

import com.linkedin.costguard.exception.InsufficientDataException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;


/**
 * The ordered outcome of a single detector run. An empty result either means that nothing was detected or that the
 * series was too short to run the detector; {@link #insufficientData()} tells the two apart.
 *
 * @param <T> Type of the detected items, e.g. anomaly alerts.
 */
public final class DetectionResult<T> implements Iterable<T> {
  private final List<T> _items;
  private final String _insufficiencyReason;

  private DetectionResult(List<T> items, String insufficiencyReason) {
    _items = items;
    _insufficiencyReason = insufficiencyReason;
  }

  /**
   * @param items Detected items, in detection order.
   * @param <T> Type of the detected items.
   * @return A result holding a copy of the given items.
   */
  public static <T> DetectionResult<T> of(List<T> items) {
    return new DetectionResult<>(Collections.unmodifiableList(new ArrayList<>(items)), null);
  }

  /**
   * @param cause The reason why the detector could not run.
   * @param <T> Type of the detected items.
   * @return An empty result flagged as insufficient.
   */
  public static <T> DetectionResult<T> insufficient(InsufficientDataException cause) {
    return new DetectionResult<>(Collections.emptyList(), cause.getMessage());
  }

  public List<T> items() {
    return _items;
  }

  public int size() {
    return _items.size();
  }

  public boolean isEmpty() {
    return _items.isEmpty();
  }

  /**
   * @return {@code true} if the detector did not run because the series had too few points.
   */
  public boolean insufficientData() {
    return _insufficiencyReason != null;
  }

  /**
   * @return The reason why the detector did not run, if it did not.
   */
  public Optional<String> insufficiencyReason() {
    return Optional.ofNullable(_insufficiencyReason);
  }

  @Override
  public Iterator<T> iterator() {
    return _items.iterator();
  }

  @Override
  public String toString() {
    return insufficientData() ? String.format("DetectionResult{insufficient: %s}", _insufficiencyReason)
                              : String.format("DetectionResult{items=%s}", _items);
  }
}
