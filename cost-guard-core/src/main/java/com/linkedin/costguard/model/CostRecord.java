/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.model;

import com.linkedin.costguard.exception.SeriesValidationException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * A single normalized cost record: the day it covers, one or more named numeric values (e.g. {@code cost},
 * {@code usage_quantity}) and the dimension tags (e.g. {@code service}, {@code team}) it was billed under.
 */
public final class CostRecord {
  public static final String TIMESTAMP_FIELD = "timestamp";
  private final LocalDate _timestamp;
  private final Map<String, Double> _values;
  private final Map<String, String> _dimensions;

  /**
   * @param timestamp The day covered by this record.
   * @param values Numeric values by field name.
   * @param dimensions Dimension tags by key.
   */
  public CostRecord(LocalDate timestamp, Map<String, Double> values, Map<String, String> dimensions) {
    if (timestamp == null) {
      throw new SeriesValidationException(TIMESTAMP_FIELD, "Cost record must have a timestamp.");
    }
    validateNotNull(values, "Values cannot be null.");
    _timestamp = timestamp;
    _values = Collections.unmodifiableMap(new TreeMap<>(values));
    _dimensions = dimensions == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(dimensions));
  }

  /**
   * Create a record with a single value field.
   *
   * @param timestamp The day covered by this record.
   * @param field Name of the value field, e.g. {@code cost}.
   * @param value The value.
   * @param dimensions Dimension tags by key.
   * @return A new record.
   */
  public static CostRecord of(LocalDate timestamp, String field, double value, Map<String, String> dimensions) {
    return new CostRecord(timestamp, Collections.singletonMap(field, value), dimensions);
  }

  /**
   * Create a record with a single value field and no dimension tags.
   *
   * @param timestamp The day covered by this record.
   * @param field Name of the value field, e.g. {@code cost}.
   * @param value The value.
   * @return A new record.
   */
  public static CostRecord of(LocalDate timestamp, String field, double value) {
    return of(timestamp, field, value, Collections.emptyMap());
  }

  public LocalDate timestamp() {
    return _timestamp;
  }

  /**
   * @param field Name of the value field.
   * @return The value of the given field, or empty if this record does not carry it.
   */
  public OptionalDouble value(String field) {
    Double value = _values.get(field);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  /**
   * @param key Dimension key.
   * @return The dimension value for the given key, or empty if this record is not tagged with it.
   */
  public Optional<String> dimension(String key) {
    return Optional.ofNullable(_dimensions.get(key));
  }

  public Map<String, Double> values() {
    return _values;
  }

  public Map<String, String> dimensions() {
    return _dimensions;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CostRecord that = (CostRecord) o;
    return _timestamp.equals(that._timestamp) && _values.equals(that._values) && _dimensions.equals(that._dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestamp, _values, _dimensions);
  }

  @Override
  public String toString() {
    return String.format("{%s, values=%s, dimensions=%s}", _timestamp, _values, _dimensions);
  }
}
