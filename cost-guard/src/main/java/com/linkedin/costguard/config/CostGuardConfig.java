/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.config;

import com.linkedin.costguard.common.config.AbstractConfig;
import com.linkedin.costguard.common.config.ConfigDef;
import com.linkedin.costguard.common.config.ConfigException;
import com.linkedin.costguard.detector.Sensitivity;
import com.linkedin.costguard.detector.changepoint.DualMovingAverageSegmentation;
import com.linkedin.costguard.detector.changepoint.OptimalSegmentation;
import com.linkedin.costguard.detector.reporter.DetectionReporter;
import com.linkedin.costguard.detector.reporter.LoggingDetectionReporter;
import com.linkedin.costguard.exception.CostGuardException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;

import static com.linkedin.costguard.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.costguard.common.config.ConfigDef.Range.between;


/**
 * The configuration for Cost Guard.
 */
public class CostGuardConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  /**
   * <code>baseline.days</code>
   */
  public static final String BASELINE_DAYS_CONFIG = "baseline.days";
  public static final int DEFAULT_BASELINE_DAYS = 14;
  private static final String BASELINE_DAYS_DOC = "The number of trailing points that make up the rolling baseline "
      + "of the baseline detector. The rolling mean and standard deviation of these points is the expected envelope "
      + "of the next point.";

  /**
   * <code>baseline.min.data.points</code>
   */
  public static final String BASELINE_MIN_DATA_POINTS_CONFIG = "baseline.min.data.points";
  public static final int DEFAULT_BASELINE_MIN_DATA_POINTS = 7;
  private static final String BASELINE_MIN_DATA_POINTS_DOC = "The minimum number of points a series must have before "
      + "the baseline detector runs, and the minimum number of trailing points a baseline must cover before a point "
      + "can be flagged.";

  /**
   * <code>baseline.sensitivity</code>
   */
  public static final String BASELINE_SENSITIVITY_CONFIG = "baseline.sensitivity";
  public static final String DEFAULT_BASELINE_SENSITIVITY = Sensitivity.MEDIUM.configName();
  private static final String BASELINE_SENSITIVITY_DOC = "The sensitivity of the baseline detector. Supported values "
      + "are low (4 standard deviations), medium (3), high (2) and very_high (1.5).";

  /**
   * <code>baseline.forecast.trend.points</code>
   */
  public static final String BASELINE_FORECAST_TREND_POINTS_CONFIG = "baseline.forecast.trend.points";
  public static final int DEFAULT_BASELINE_FORECAST_TREND_POINTS = 7;
  private static final String BASELINE_FORECAST_TREND_POINTS_DOC = "The number of trailing points whose mean "
      + "day-over-day change is extrapolated by the linear forecast.";

  /**
   * <code>changepoint.min.segment.length</code>
   */
  public static final String CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG = "changepoint.min.segment.length";
  public static final int DEFAULT_CHANGEPOINT_MIN_SEGMENT_LENGTH = 3;
  private static final String CHANGEPOINT_MIN_SEGMENT_LENGTH_DOC = "The minimum number of points between two change "
      + "points. A series needs at least twice this many points for change point detection.";

  /**
   * <code>changepoint.penalty</code>
   */
  public static final String CHANGEPOINT_PENALTY_CONFIG = "changepoint.penalty";
  public static final double DEFAULT_CHANGEPOINT_PENALTY = 10.0;
  private static final String CHANGEPOINT_PENALTY_DOC = "The cost of adding a change point to the segmentation, in "
      + "units of the estimated noise variance of the series. Higher values yield fewer and coarser segments.";

  /**
   * <code>changepoint.context.points</code>
   */
  public static final String CHANGEPOINT_CONTEXT_POINTS_CONFIG = "changepoint.context.points";
  public static final int DEFAULT_CHANGEPOINT_CONTEXT_POINTS = 7;
  private static final String CHANGEPOINT_CONTEXT_POINTS_DOC = "The maximum number of points on each side of a change "
      + "point that are averaged into its before and after means.";

  /**
   * <code>changepoint.segmentation.class</code>
   */
  public static final String CHANGEPOINT_SEGMENTATION_CLASS_CONFIG = "changepoint.segmentation.class";
  public static final String DEFAULT_CHANGEPOINT_SEGMENTATION_CLASS = OptimalSegmentation.class.getName();
  private static final String CHANGEPOINT_SEGMENTATION_CLASS_DOC = "The segmentation strategy used to locate change "
      + "points. If it cannot be loaded or fails on a series, the fallback strategy is used instead.";

  /**
   * <code>changepoint.fallback.segmentation.class</code>
   */
  public static final String CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_CONFIG = "changepoint.fallback.segmentation.class";
  public static final String DEFAULT_CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS = DualMovingAverageSegmentation.class.getName();
  private static final String CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_DOC = "The approximate segmentation strategy used "
      + "when the primary strategy is unavailable.";

  /**
   * <code>changepoint.optimal.max.series.length</code>
   */
  public static final String CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_CONFIG = "changepoint.optimal.max.series.length";
  public static final int DEFAULT_CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH = 10000;
  private static final String CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_DOC = "The longest series the optimal segmentation "
      + "accepts. Its running time is quadratic in the series length; longer series are handled by the fallback.";

  /**
   * <code>changepoint.fallback.short.window</code>
   */
  public static final String CHANGEPOINT_FALLBACK_SHORT_WINDOW_CONFIG = "changepoint.fallback.short.window";
  public static final int DEFAULT_CHANGEPOINT_FALLBACK_SHORT_WINDOW = 7;
  private static final String CHANGEPOINT_FALLBACK_SHORT_WINDOW_DOC = "The length of the short moving average of the "
      + "fallback segmentation.";

  /**
   * <code>changepoint.fallback.long.window</code>
   */
  public static final String CHANGEPOINT_FALLBACK_LONG_WINDOW_CONFIG = "changepoint.fallback.long.window";
  public static final int DEFAULT_CHANGEPOINT_FALLBACK_LONG_WINDOW = 30;
  private static final String CHANGEPOINT_FALLBACK_LONG_WINDOW_DOC = "The length of the long moving average of the "
      + "fallback segmentation.";

  /**
   * <code>changepoint.fallback.threshold</code>
   */
  public static final String CHANGEPOINT_FALLBACK_THRESHOLD_CONFIG = "changepoint.fallback.threshold";
  public static final double DEFAULT_CHANGEPOINT_FALLBACK_THRESHOLD = 0.30;
  private static final String CHANGEPOINT_FALLBACK_THRESHOLD_DOC = "The relative difference between the short and the "
      + "long moving average above which the fallback segmentation flags a change point.";

  /**
   * <code>changepoint.fallback.min.data.points</code>
   */
  public static final String CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_CONFIG = "changepoint.fallback.min.data.points";
  public static final int DEFAULT_CHANGEPOINT_FALLBACK_MIN_DATA_POINTS = 14;
  private static final String CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_DOC = "The minimum number of points the fallback "
      + "segmentation needs; it also is the minimum number of points the long moving average must cover.";

  /**
   * <code>ensemble.min.detectors.agreement</code>
   */
  public static final String ENSEMBLE_MIN_DETECTORS_AGREEMENT_CONFIG = "ensemble.min.detectors.agreement";
  public static final int DEFAULT_ENSEMBLE_MIN_DETECTORS_AGREEMENT = 1;
  private static final String ENSEMBLE_MIN_DETECTORS_AGREEMENT_DOC = "The minimum number of detectors that must agree "
      + "on an event. Reserved for voting across more detectors; the correlation currently pairs the two detectors.";

  /**
   * <code>ensemble.correlation.window.days</code>
   */
  public static final String ENSEMBLE_CORRELATION_WINDOW_DAYS_CONFIG = "ensemble.correlation.window.days";
  public static final int DEFAULT_ENSEMBLE_CORRELATION_WINDOW_DAYS = 3;
  private static final String ENSEMBLE_CORRELATION_WINDOW_DAYS_DOC = "The maximum number of days (inclusive) between a "
      + "baseline anomaly and a change point for them to be reported as a high-confidence event.";

  /**
   * <code>ensemble.min.group.points</code>
   */
  public static final String ENSEMBLE_MIN_GROUP_POINTS_CONFIG = "ensemble.min.group.points";
  public static final int DEFAULT_ENSEMBLE_MIN_GROUP_POINTS = 7;
  private static final String ENSEMBLE_MIN_GROUP_POINTS_DOC = "The minimum number of points a group must have to be "
      + "included in grouped ensemble detection.";

  /**
   * <code>dimension.keys</code>
   */
  public static final String DIMENSION_KEYS_CONFIG = "dimension.keys";
  public static final String DEFAULT_DIMENSION_KEYS = "service,team,environment,project,region";
  private static final String DIMENSION_KEYS_DOC = "The dimension keys recognized on cost records. Only these keys are "
      + "copied into the dimension snapshot of alerts and used for partitioning.";

  /**
   * <code>detection.reporter.class</code>
   */
  public static final String DETECTION_REPORTER_CLASS_CONFIG = "detection.reporter.class";
  public static final String DEFAULT_DETECTION_REPORTER_CLASS = LoggingDetectionReporter.class.getName();
  private static final String DETECTION_REPORTER_CLASS_DOC = "The reporter that is notified of every detected anomaly, "
      + "change point and high-confidence event. The metrics reporter registers its meters in the shared Dropwizard "
      + "metric registry named cost-guard.";

  static {
    CONFIG = new ConfigDef()
        .define(BASELINE_DAYS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_BASELINE_DAYS,
                atLeast(1),
                ConfigDef.Importance.HIGH,
                BASELINE_DAYS_DOC)
        .define(BASELINE_MIN_DATA_POINTS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_BASELINE_MIN_DATA_POINTS,
                atLeast(1),
                ConfigDef.Importance.HIGH,
                BASELINE_MIN_DATA_POINTS_DOC)
        .define(BASELINE_SENSITIVITY_CONFIG,
                ConfigDef.Type.STRING,
                DEFAULT_BASELINE_SENSITIVITY,
                ConfigDef.ValidString.in(Sensitivity.configNames()),
                ConfigDef.Importance.HIGH,
                BASELINE_SENSITIVITY_DOC)
        .define(BASELINE_FORECAST_TREND_POINTS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_BASELINE_FORECAST_TREND_POINTS,
                atLeast(2),
                ConfigDef.Importance.LOW,
                BASELINE_FORECAST_TREND_POINTS_DOC)
        .define(CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_CHANGEPOINT_MIN_SEGMENT_LENGTH,
                atLeast(1),
                ConfigDef.Importance.HIGH,
                CHANGEPOINT_MIN_SEGMENT_LENGTH_DOC)
        .define(CHANGEPOINT_PENALTY_CONFIG,
                ConfigDef.Type.DOUBLE,
                DEFAULT_CHANGEPOINT_PENALTY,
                atLeast(0.0),
                ConfigDef.Importance.HIGH,
                CHANGEPOINT_PENALTY_DOC)
        .define(CHANGEPOINT_CONTEXT_POINTS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_CHANGEPOINT_CONTEXT_POINTS,
                atLeast(1),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_CONTEXT_POINTS_DOC)
        .define(CHANGEPOINT_SEGMENTATION_CLASS_CONFIG,
                ConfigDef.Type.STRING,
                DEFAULT_CHANGEPOINT_SEGMENTATION_CLASS,
                new ConfigDef.NonEmptyString(),
                ConfigDef.Importance.MEDIUM,
                CHANGEPOINT_SEGMENTATION_CLASS_DOC)
        .define(CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_CONFIG,
                ConfigDef.Type.STRING,
                DEFAULT_CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS,
                new ConfigDef.NonEmptyString(),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_FALLBACK_SEGMENTATION_CLASS_DOC)
        .define(CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH,
                atLeast(2),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_DOC)
        .define(CHANGEPOINT_FALLBACK_SHORT_WINDOW_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_CHANGEPOINT_FALLBACK_SHORT_WINDOW,
                atLeast(1),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_FALLBACK_SHORT_WINDOW_DOC)
        .define(CHANGEPOINT_FALLBACK_LONG_WINDOW_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_CHANGEPOINT_FALLBACK_LONG_WINDOW,
                atLeast(2),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_FALLBACK_LONG_WINDOW_DOC)
        .define(CHANGEPOINT_FALLBACK_THRESHOLD_CONFIG,
                ConfigDef.Type.DOUBLE,
                DEFAULT_CHANGEPOINT_FALLBACK_THRESHOLD,
                between(0.0, 10.0),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_FALLBACK_THRESHOLD_DOC)
        .define(CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_CHANGEPOINT_FALLBACK_MIN_DATA_POINTS,
                atLeast(2),
                ConfigDef.Importance.LOW,
                CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_DOC)
        .define(ENSEMBLE_MIN_DETECTORS_AGREEMENT_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_ENSEMBLE_MIN_DETECTORS_AGREEMENT,
                between(1, 2),
                ConfigDef.Importance.LOW,
                ENSEMBLE_MIN_DETECTORS_AGREEMENT_DOC)
        .define(ENSEMBLE_CORRELATION_WINDOW_DAYS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_ENSEMBLE_CORRELATION_WINDOW_DAYS,
                atLeast(0),
                ConfigDef.Importance.MEDIUM,
                ENSEMBLE_CORRELATION_WINDOW_DAYS_DOC)
        .define(ENSEMBLE_MIN_GROUP_POINTS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_ENSEMBLE_MIN_GROUP_POINTS,
                atLeast(1),
                ConfigDef.Importance.MEDIUM,
                ENSEMBLE_MIN_GROUP_POINTS_DOC)
        .define(DIMENSION_KEYS_CONFIG,
                ConfigDef.Type.LIST,
                DEFAULT_DIMENSION_KEYS,
                ConfigDef.Importance.MEDIUM,
                DIMENSION_KEYS_DOC)
        .define(DETECTION_REPORTER_CLASS_CONFIG,
                ConfigDef.Type.STRING,
                DEFAULT_DETECTION_REPORTER_CLASS,
                new ConfigDef.NonEmptyString(),
                ConfigDef.Importance.LOW,
                DETECTION_REPORTER_CLASS_DOC);
  }

  public CostGuardConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckWindows();
    if (doLog) {
      logUnused();
    }
  }

  public CostGuardConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  /**
   * @return A configuration with every key at its default value.
   */
  public static CostGuardConfig defaults() {
    return new CostGuardConfig(Collections.emptyMap(), false);
  }

  /**
   * Load the configuration from the given properties file.
   *
   * @param propertiesFile Path of the properties file.
   * @return The parsed configuration.
   * @throws IOException If the file cannot be read.
   */
  public static CostGuardConfig fromPropertiesFile(Path propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream in = Files.newInputStream(propertiesFile)) {
      props.load(in);
    }
    return new CostGuardConfig(props);
  }

  /**
   * @return Sensitivity of the baseline detector.
   */
  public Sensitivity sensitivity() {
    return Sensitivity.forConfigName(getString(BASELINE_SENSITIVITY_CONFIG));
  }

  /**
   * @return A configured instance of the reporter named by {@link #DETECTION_REPORTER_CLASS_CONFIG}.
   */
  public DetectionReporter detectionReporter() {
    try {
      return getConfiguredInstance(DETECTION_REPORTER_CLASS_CONFIG, DetectionReporter.class);
    } catch (ClassNotFoundException | CostGuardException e) {
      throw new ConfigException(DETECTION_REPORTER_CLASS_CONFIG, getString(DETECTION_REPORTER_CLASS_CONFIG),
                                "Cannot instantiate the detection reporter.", e);
    }
  }

  /**
   * Sanity check to ensure that
   * <ul>
   *   <li>{@link #BASELINE_MIN_DATA_POINTS_CONFIG} is no larger than {@link #BASELINE_DAYS_CONFIG}</li>
   *   <li>{@link #CHANGEPOINT_FALLBACK_SHORT_WINDOW_CONFIG} is smaller than {@link #CHANGEPOINT_FALLBACK_LONG_WINDOW_CONFIG}</li>
   *   <li>{@link #CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_CONFIG} is no larger than {@link #CHANGEPOINT_FALLBACK_LONG_WINDOW_CONFIG}</li>
   * </ul>
   */
  private void sanityCheckWindows() {
    int baselineDays = getInt(BASELINE_DAYS_CONFIG);
    int baselineMinPoints = getInt(BASELINE_MIN_DATA_POINTS_CONFIG);
    if (baselineMinPoints > baselineDays) {
      throw new IllegalArgumentException(String.format("Baseline minimum data points (%d) cannot exceed the baseline days (%d).",
                                                       baselineMinPoints, baselineDays));
    }
    int shortWindow = getInt(CHANGEPOINT_FALLBACK_SHORT_WINDOW_CONFIG);
    int longWindow = getInt(CHANGEPOINT_FALLBACK_LONG_WINDOW_CONFIG);
    int fallbackMinPoints = getInt(CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_CONFIG);
    if (shortWindow >= longWindow) {
      throw new IllegalArgumentException(String.format("Short window (%d) must be smaller than the long window (%d).",
                                                       shortWindow, longWindow));
    }
    if (fallbackMinPoints > longWindow) {
      throw new IllegalArgumentException(String.format("Fallback minimum data points (%d) cannot exceed the long window (%d).",
                                                       fallbackMinPoints, longWindow));
    }
  }
}
