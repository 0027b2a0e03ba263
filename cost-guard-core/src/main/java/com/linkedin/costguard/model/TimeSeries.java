/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.model;

import com.linkedin.costguard.CostGuardUtils;
import com.linkedin.costguard.exception.SeriesValidationException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * An immutable, date-ordered sequence of {@link CostRecord}s.
 *
 * <p>Records are sorted ascending by timestamp when the series is built. The sort is stable and records sharing a
 * timestamp are kept as they are; deduplication is the responsibility of whoever produced the records.
 */
public final class TimeSeries {
  private static final TimeSeries EMPTY = new TimeSeries(Collections.emptyList());
  private final List<CostRecord> _records;
  private final Set<String> _valueFields;
  private final Set<String> _dimensionKeys;

  public TimeSeries(Collection<CostRecord> records) {
    validateNotNull(records, "Records cannot be null.");
    List<CostRecord> sorted = new ArrayList<>(records);
    sorted.sort(Comparator.comparing(CostRecord::timestamp));
    _records = Collections.unmodifiableList(sorted);
    Set<String> valueFields = new TreeSet<>();
    Set<String> dimensionKeys = new TreeSet<>();
    for (CostRecord record : sorted) {
      valueFields.addAll(record.values().keySet());
      dimensionKeys.addAll(record.dimensions().keySet());
    }
    _valueFields = Collections.unmodifiableSet(valueFields);
    _dimensionKeys = Collections.unmodifiableSet(dimensionKeys);
  }

  public static TimeSeries empty() {
    return EMPTY;
  }

  /**
   * Build a series with a single value field from the given values, one record per consecutive day.
   *
   * @param start Timestamp of the first value.
   * @param field Name of the value field.
   * @param values Values, one per day.
   * @return A new series.
   */
  public static TimeSeries daily(LocalDate start, String field, double... values) {
    List<CostRecord> records = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      records.add(CostRecord.of(start.plusDays(i), field, values[i]));
    }
    return new TimeSeries(records);
  }

  public int size() {
    return _records.size();
  }

  public boolean isEmpty() {
    return _records.isEmpty();
  }

  public CostRecord get(int index) {
    return _records.get(index);
  }

  public List<CostRecord> records() {
    return _records;
  }

  /**
   * @return Names of the value fields carried by at least one record.
   */
  public Set<String> valueFields() {
    return _valueFields;
  }

  /**
   * @return Dimension keys carried by at least one record.
   */
  public Set<String> dimensionKeys() {
    return _dimensionKeys;
  }

  public List<LocalDate> timestamps() {
    List<LocalDate> timestamps = new ArrayList<>(_records.size());
    for (CostRecord record : _records) {
      timestamps.add(record.timestamp());
    }
    return timestamps;
  }

  /**
   * Extract the values of the given field in timestamp order.
   *
   * @param field Name of the value field.
   * @return The values of the given field.
   * @throws SeriesValidationException If any record does not carry the given field.
   */
  public double[] values(String field) {
    double[] values = new double[_records.size()];
    for (int i = 0; i < _records.size(); i++) {
      OptionalDouble value = _records.get(i).value(field);
      if (!value.isPresent()) {
        throw new SeriesValidationException(field, String.format("Value field '%s' is missing from the record at %s.",
                                                                 field, _records.get(i).timestamp()));
      }
      values[i] = value.getAsDouble();
    }
    return values;
  }

  /**
   * Partition this series by the distinct values of the given dimension key. Records that are not tagged with the
   * key belong to no partition. Each partition keeps the timestamp order of this series.
   *
   * @param dimensionKey Dimension key to partition by, e.g. {@code service}.
   * @return Partitions sorted by dimension value.
   * @throws SeriesValidationException If no record of this series carries the given key.
   */
  public SortedMap<String, TimeSeries> partitionBy(String dimensionKey) {
    if (!_dimensionKeys.contains(dimensionKey)) {
      throw new SeriesValidationException(dimensionKey, String.format("Dimension '%s' not found. Available dimensions: %s.",
                                                                      dimensionKey, _dimensionKeys));
    }
    SortedMap<String, List<CostRecord>> recordsByValue = new TreeMap<>();
    for (CostRecord record : _records) {
      Optional<String> dimensionValue = record.dimension(dimensionKey);
      dimensionValue.ifPresent(v -> recordsByValue.computeIfAbsent(v, k -> new ArrayList<>()).add(record));
    }
    SortedMap<String, TimeSeries> partitions = new TreeMap<>();
    for (Map.Entry<String, List<CostRecord>> entry : recordsByValue.entrySet()) {
      partitions.put(entry.getKey(), new TimeSeries(entry.getValue()));
    }
    return partitions;
  }

  /**
   * Ensure that the given value field exists in this series. An empty series has no schema, hence passes.
   *
   * @param field Name of the value field.
   * @throws SeriesValidationException If the series is non-empty and no record carries the given field.
   */
  public void ensureValueField(String field) {
    CostGuardUtils.ensureValidString("Value field", field);
    if (!_records.isEmpty() && !_valueFields.contains(field)) {
      throw new SeriesValidationException(field, String.format("Value field '%s' not found. Available fields: %s.",
                                                               field, _valueFields));
    }
  }

  @Override
  public String toString() {
    return String.format("TimeSeries{size=%d, valueFields=%s, dimensionKeys=%s}", _records.size(), _valueFields,
                         _dimensionKeys);
  }
}
