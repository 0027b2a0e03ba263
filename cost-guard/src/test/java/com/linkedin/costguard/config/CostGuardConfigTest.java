/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.config;

import com.linkedin.costguard.common.config.ConfigException;
import com.linkedin.costguard.detector.Sensitivity;
import com.linkedin.costguard.detector.reporter.LoggingDetectionReporter;
import com.linkedin.costguard.detector.reporter.MetricsDetectionReporter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Properties;
import org.junit.Test;

import static com.linkedin.costguard.CostGuardTestUtils.config;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class CostGuardConfigTest {

  @Test
  public void testDefaults() {
    CostGuardConfig config = CostGuardConfig.defaults();
    assertEquals(Integer.valueOf(14), config.getInt(CostGuardConfig.BASELINE_DAYS_CONFIG));
    assertEquals(Integer.valueOf(7), config.getInt(CostGuardConfig.BASELINE_MIN_DATA_POINTS_CONFIG));
    assertEquals(Sensitivity.MEDIUM, config.sensitivity());
    assertEquals(Integer.valueOf(3), config.getInt(CostGuardConfig.CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG));
    assertEquals(10.0, config.getDouble(CostGuardConfig.CHANGEPOINT_PENALTY_CONFIG), 0.0);
    assertEquals(Integer.valueOf(1), config.getInt(CostGuardConfig.ENSEMBLE_MIN_DETECTORS_AGREEMENT_CONFIG));
    assertEquals(Integer.valueOf(3), config.getInt(CostGuardConfig.ENSEMBLE_CORRELATION_WINDOW_DAYS_CONFIG));
    assertEquals(Arrays.asList("service", "team", "environment", "project", "region"),
                 config.getList(CostGuardConfig.DIMENSION_KEYS_CONFIG));
    assertTrue(config.detectionReporter() instanceof LoggingDetectionReporter);
  }

  @Test
  public void testPropertiesFileMatchesDefaults() throws Exception {
    Path defaults = Paths.get(getClass().getClassLoader().getResource("cost-guard.properties").toURI());
    CostGuardConfig config = CostGuardConfig.fromPropertiesFile(defaults);
    assertEquals(CostGuardConfig.defaults().values(), config.values());
  }

  @Test
  public void testSensitivity() {
    assertEquals(Sensitivity.VERY_HIGH, config(CostGuardConfig.BASELINE_SENSITIVITY_CONFIG, "very_high").sensitivity());
    assertThrows(ConfigException.class, () -> config(CostGuardConfig.BASELINE_SENSITIVITY_CONFIG, "extreme"));
  }

  @Test
  public void testOutOfRangeValues() {
    assertThrows(ConfigException.class, () -> config(CostGuardConfig.BASELINE_DAYS_CONFIG, "0"));
    assertThrows(ConfigException.class, () -> config(CostGuardConfig.CHANGEPOINT_PENALTY_CONFIG, "-1"));
    assertThrows(ConfigException.class, () -> config(CostGuardConfig.ENSEMBLE_MIN_DETECTORS_AGREEMENT_CONFIG, "3"));
    assertThrows(ConfigException.class, () -> config(CostGuardConfig.CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG, "three"));
  }

  @Test
  public void testInconsistentWindows() {
    assertThrows(IllegalArgumentException.class, () -> config(CostGuardConfig.BASELINE_DAYS_CONFIG, "5"));
    assertThrows(IllegalArgumentException.class, () -> config(CostGuardConfig.CHANGEPOINT_FALLBACK_SHORT_WINDOW_CONFIG, "30"));
    assertThrows(IllegalArgumentException.class, () -> config(CostGuardConfig.CHANGEPOINT_FALLBACK_MIN_DATA_POINTS_CONFIG, "31"));
  }

  @Test
  public void testDetectionReporter() {
    CostGuardConfig config = config(CostGuardConfig.DETECTION_REPORTER_CLASS_CONFIG, MetricsDetectionReporter.class.getName());
    assertTrue(config.detectionReporter() instanceof MetricsDetectionReporter);

    Properties props = new Properties();
    props.setProperty(CostGuardConfig.DETECTION_REPORTER_CLASS_CONFIG, "com.linkedin.costguard.NoSuchReporter");
    CostGuardConfig missing = new CostGuardConfig(props, false);
    assertThrows(ConfigException.class, missing::detectionReporter);

    props.setProperty(CostGuardConfig.DETECTION_REPORTER_CLASS_CONFIG, String.class.getName());
    CostGuardConfig notAReporter = new CostGuardConfig(props, false);
    assertThrows(ConfigException.class, notAReporter::detectionReporter);
  }
}
