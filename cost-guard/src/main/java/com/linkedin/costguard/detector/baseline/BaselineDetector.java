/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.baseline;

import com.linkedin.costguard.CostGuardUtils;
import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.detector.DetectionResult;
import com.linkedin.costguard.detector.Sensitivity;
import com.linkedin.costguard.detector.Severity;
import com.linkedin.costguard.detector.reporter.DetectionReporter;
import com.linkedin.costguard.exception.InsufficientDataException;
import com.linkedin.costguard.model.CostRecord;
import com.linkedin.costguard.model.TimeSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * Flags points that fall outside a rolling statistical envelope.
 *
 * <p>The envelope of a point is built from the up to {@link CostGuardConfig#BASELINE_DAYS_CONFIG} points that precede
 * it: {@code mean +/- k * std}, where {@code std} is the sample standard deviation of those points and {@code k} is
 * the standard deviation multiplier of the configured {@link Sensitivity}. A point is only evaluated once at least
 * {@link CostGuardConfig#BASELINE_MIN_DATA_POINTS_CONFIG} preceding points are available. A point strictly outside
 * the envelope raises an {@link AnomalyAlert}.
 *
 * <p>The detector holds no state between calls and can be shared across threads.
 */
public class BaselineDetector {
  private static final Logger LOG = LoggerFactory.getLogger(BaselineDetector.class);
  public static final String NAME = "baseline";
  private final int _baselineDays;
  private final int _minDataPoints;
  private final int _forecastTrendPoints;
  private final Sensitivity _sensitivity;
  private final Set<String> _dimensionKeys;
  private final DetectionReporter _reporter;

  public BaselineDetector(CostGuardConfig config) {
    this(config, config.detectionReporter());
  }

  public BaselineDetector(CostGuardConfig config, DetectionReporter reporter) {
    validateNotNull(config, "Config cannot be null.");
    _baselineDays = config.getInt(CostGuardConfig.BASELINE_DAYS_CONFIG);
    _minDataPoints = config.getInt(CostGuardConfig.BASELINE_MIN_DATA_POINTS_CONFIG);
    _forecastTrendPoints = config.getInt(CostGuardConfig.BASELINE_FORECAST_TREND_POINTS_CONFIG);
    _sensitivity = config.sensitivity();
    _dimensionKeys = Collections.unmodifiableSet(new HashSet<>(config.getList(CostGuardConfig.DIMENSION_KEYS_CONFIG)));
    _reporter = validateNotNull(reporter, "Detection reporter cannot be null.");
  }

  /**
   * Detect anomalies in the given value field of the given series.
   *
   * @param series The series to analyze.
   * @param valueField Name of the value field, e.g. {@code cost}.
   * @return The anomalies in timestamp order, or an empty result flagged as insufficient if the series has fewer than
   * the minimum number of points.
   */
  public DetectionResult<AnomalyAlert> detect(TimeSeries series, String valueField) {
    validateNotNull(series, "Series cannot be null.");
    series.ensureValueField(valueField);
    try {
      ensureEnoughPoints(series.size());
    } catch (InsufficientDataException ide) {
      LOG.warn("Cannot run {} detection on {}: {}", NAME, valueField, ide.getMessage());
      _reporter.onInsufficientData(NAME, ide);
      return DetectionResult.insufficient(ide);
    }

    double[] values = series.values(valueField);
    DescriptiveStatistics window = new DescriptiveStatistics(_baselineDays);
    List<AnomalyAlert> alerts = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      if (window.getN() >= _minDataPoints) {
        AnomalyAlert alert = evaluate(series.get(i), valueField, values[i], window.getMean(), window.getStandardDeviation());
        if (alert != null) {
          alerts.add(alert);
          _reporter.onAnomalyAlert(alert);
        }
      }
      window.addValue(values[i]);
    }
    LOG.debug("Found {} {} anomalies in {} points of {}.", alerts.size(), NAME, values.length, valueField);
    return DetectionResult.of(alerts);
  }

  /**
   * Run {@link #detect(TimeSeries, String)} on every partition of the series by the given dimension key. Partitions
   * with fewer than the minimum number of points are skipped, and partitions without anomalies are left out.
   *
   * @param series The series to analyze.
   * @param dimensionKey Dimension key to partition by, e.g. {@code service}.
   * @param valueField Name of the value field.
   * @return Anomalies by dimension value, sorted by dimension value.
   */
  public SortedMap<String, DetectionResult<AnomalyAlert>> detectByDimension(TimeSeries series,
                                                                             String dimensionKey,
                                                                             String valueField) {
    validateNotNull(series, "Series cannot be null.");
    SortedMap<String, DetectionResult<AnomalyAlert>> resultsByDimension = new TreeMap<>();
    for (Map.Entry<String, TimeSeries> entry : series.partitionBy(dimensionKey).entrySet()) {
      TimeSeries partition = entry.getValue();
      if (partition.size() < _minDataPoints) {
        LOG.debug("Skipping {}={} with {} points.", dimensionKey, entry.getKey(), partition.size());
        continue;
      }
      DetectionResult<AnomalyAlert> result = detect(partition, valueField);
      if (!result.isEmpty()) {
        LOG.info("Found {} anomalies for {}={}", result.size(), dimensionKey, entry.getKey());
        resultsByDimension.put(entry.getKey(), result);
      }
    }
    return resultsByDimension;
  }

  /**
   * Extrapolate the mean day-over-day change of the most recent points from the last observed value.
   *
   * @param series The series to forecast.
   * @param horizon Number of days to forecast.
   * @param valueField Name of the value field.
   * @return One forecast per day following the last timestamp of the series, or an empty list if the series has
   * fewer than the minimum number of points.
   */
  public List<ForecastPoint> forecast(TimeSeries series, int horizon, String valueField) {
    validateNotNull(series, "Series cannot be null.");
    if (horizon < 1) {
      throw new IllegalArgumentException("Forecast horizon must be positive, but was " + horizon);
    }
    series.ensureValueField(valueField);
    if (series.size() < _minDataPoints) {
      LOG.warn("Cannot forecast {}: insufficient data points: {} < {}", valueField, series.size(), _minDataPoints);
      return Collections.emptyList();
    }
    double[] values = series.values(valueField);
    int trendPoints = Math.min(_forecastTrendPoints, values.length);
    double lastValue = values[values.length - 1];
    double dailyChange = trendPoints < 2 ? 0.0 : (lastValue - values[values.length - trendPoints]) / (trendPoints - 1);
    LocalDate lastTimestamp = series.get(series.size() - 1).timestamp();

    List<ForecastPoint> forecast = new ArrayList<>(horizon);
    for (int day = 1; day <= horizon; day++) {
      forecast.add(new ForecastPoint(lastTimestamp.plusDays(day), lastValue + day * dailyChange));
    }
    return forecast;
  }

  private void ensureEnoughPoints(int numPoints) throws InsufficientDataException {
    if (numPoints < _minDataPoints) {
      throw new InsufficientDataException(numPoints, _minDataPoints);
    }
  }

  /**
   * @return An alert if the value is outside the envelope of the given baseline, {@code null} otherwise.
   */
  private AnomalyAlert evaluate(CostRecord record, String valueField, double actual, double expected, double stdDev) {
    double margin = _sensitivity.stdDevMultiplier() * stdDev;
    double upper = expected + margin;
    double lower = expected - margin;
    LOG.trace("{} {}={} envelope [{}, {}]", record.timestamp(), valueField, actual, lower, upper);
    if (actual <= upper && actual >= lower) {
      return null;
    }

    boolean spike = actual > upper;
    double confidence;
    if (spike) {
      confidence = upper > expected ? (actual - upper) / (upper - expected) : 1.0;
    } else {
      confidence = expected > lower ? (lower - actual) / (expected - lower) : 1.0;
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    double deviation = CostGuardUtils.percentChange(expected, actual);
    String message = String.format(Locale.ROOT, "%s %s: $%.2f vs expected $%.2f (%+.1f%%)",
                                   CostGuardUtils.capitalize(valueField), spike ? "spike" : "drop", actual, expected,
                                   deviation);
    return new AnomalyAlert(record.timestamp(), valueField, actual, expected, deviation, Severity.forPercent(deviation),
                            confidence, recognizedDimensions(record), message);
  }

  private Map<String, String> recognizedDimensions(CostRecord record) {
    Map<String, String> dimensions = new TreeMap<>();
    for (Map.Entry<String, String> entry : record.dimensions().entrySet()) {
      if (_dimensionKeys.contains(entry.getKey())) {
        dimensions.put(entry.getKey(), entry.getValue());
      }
    }
    return dimensions;
  }
}
